/**
 * Tabular profile output and JSON farm-item input.
 */
package org.agroforestry.farmprofile.infrastructure.io;
