/**
 * Connection extraction stages.
 *
 * <p>Each stage is a {@link com.purchasingpower.wiregraph.extract.ConnectionExtractor}
 * bean run in {@code @Order}:
 * <ul>
 *   <li>{@code HorizontalWireExtractor} - straight runs between adjacent points on a spec row</li>
 *   <li>{@code RoutingPathExtractor} - polylines and routing paths, including splice chains</li>
 *   <li>{@code GroundConnectionExtractor} - pins wired to ground arrows</li>
 *   <li>{@code LongRoutingResolver} - splice links inferred from wire flow balance</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.wiregraph.extract;
