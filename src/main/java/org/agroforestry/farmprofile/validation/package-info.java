/**
 * Input validation helpers shared by configuration loaders and use cases.
 */
package org.agroforestry.farmprofile.validation;
