/**
 * REST API layer: controllers and DTOs.
 *
 * <p>Exposes extraction through {@code POST /api/v1/diagrams/connections} (JSON) and
 * {@code POST /api/v1/diagrams/report} (markdown).
 *
 * @since 1.0.0
 */
package com.purchasingpower.wiregraph.api;
