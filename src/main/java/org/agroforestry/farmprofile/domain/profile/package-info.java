/**
 * Farm profile record, its schema fields and the data-dictionary value domains.
 */
package org.agroforestry.farmprofile.domain.profile;
