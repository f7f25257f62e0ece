/**
 * Decorators for the geospatial query port.
 */
package org.agroforestry.farmprofile.infrastructure.query;
