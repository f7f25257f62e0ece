/**
 * Soil texture classes: the normalized-name lookup table and the label normalizer.
 */
package org.agroforestry.farmprofile.domain.texture;
