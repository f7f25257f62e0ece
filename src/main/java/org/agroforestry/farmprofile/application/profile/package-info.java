/**
 * Farm profile creation and refresh use cases.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.application.profile;
