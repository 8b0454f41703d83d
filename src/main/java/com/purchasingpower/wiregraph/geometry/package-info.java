/**
 * SVG reading: labels, splice dots, polylines and styled paths.
 *
 * @since 1.0.0
 */
package com.purchasingpower.wiregraph.geometry;
