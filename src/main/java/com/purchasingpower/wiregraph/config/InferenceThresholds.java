package com.purchasingpower.wiregraph.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Distance and tolerance thresholds used by the connection inference engine.
 *
 * <p>All values are in drawing units of the exported diagram. The defaults were calibrated
 * against production wiring diagrams and should only be changed together with a regression
 * run over a known diagram set.
 *
 * <p>Properties are loaded from the {@code wiregraph.inference} namespace in application.yml.
 * Example configuration:
 * <pre>
 * wiregraph:
 *   inference:
 *     connector-max-x-distance: 50
 *     junction-max-x-distance: 100
 *     max-unbridged-pair-distance: 220
 * </pre>
 *
 * <p><b>Thread Safety:</b> Spring manages a single instance; the engine only reads it.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "wiregraph.inference")
public class InferenceThresholds {

    // ---------------------------------------------------------------------
    // Connector resolution
    // ---------------------------------------------------------------------

    /**
     * Maximum horizontal offset between a pin and a plain connector label above it.
     * Pins are printed directly below their connector, so anything wider belongs
     * to a neighbouring connector.
     * Default: 50
     */
    @Positive
    private double connectorMaxXDistance = 50;

    /**
     * Maximum horizontal offset for junction labels, which are drawn as a mirrored
     * pair and therefore sit further from the shared pin.
     * Default: 100
     */
    @Positive
    private double junctionMaxXDistance = 100;

    /**
     * A connector label must sit more than this many units above the pin.
     * Labels on the pin row are neighbours, not owners.
     * Default: 5
     */
    @PositiveOrZero
    private double connectorMinVerticalGap = 5;

    /**
     * A connector label may sit at most this many units above the pin.
     * Default: 500
     */
    @Positive
    private double connectorMaxVerticalGap = 500;

    /**
     * When a destination pin has a known source X, connectors lying between source and
     * pin are preferred only when they are this close vertically.
     * Default: 60
     */
    @Positive
    private double betweenPreferenceMaxVerticalGap = 60;

    /**
     * Number of closest candidates examined for a mirrored junction pair.
     * Default: 3
     */
    @Positive
    private int junctionPairWindow = 3;

    // ---------------------------------------------------------------------
    // Horizontal wires
    // ---------------------------------------------------------------------

    /**
     * Wire spec Y values are rounded to this bucket size to form horizontal bands.
     * Default: 10
     */
    @Positive
    private double specBandBucket = 10;

    /**
     * A connection point belongs to a band when it is this close in Y to any spec of the band.
     * Default: 10
     */
    @Positive
    private double bandYTolerance = 10;

    /**
     * Bands whose points spread over more than this many Y units are split into sub-bands.
     * Default: 15
     */
    @Positive
    private double bandSpreadTolerance = 15;

    /**
     * A point joins a sub-band when it lies within this many Y units of the sub-band's
     * lowest or highest point.
     * Default: 3
     */
    @Positive
    private double subBandGap = 3;

    /**
     * Points closer than this in X are treated as the same column; only one survives.
     * Default: 0.5
     */
    @Positive
    private double sameColumnTolerance = 0.5;

    /**
     * Two points whose Y distances to the attributed spec differ by more than this belong
     * to different wires drawn close together.
     * Default: 5
     */
    @Positive
    private double wireLevelMismatch = 5;

    /**
     * Adjacent points farther apart than this are only connected if a spec lies between them.
     * Default: 220
     */
    @Positive
    private double maxUnbridgedPairDistance = 220;

    /**
     * Connector labels farther apart than this mark different modules unless a spec
     * lies between them.
     * Default: 100
     */
    @Positive
    private double moduleBoundaryDistance = 100;

    /**
     * Y tolerance for a foreign connector label to count as sitting on the same row
     * between two splices.
     * Default: 15
     */
    @Positive
    private double boundaryLabelYTolerance = 15;

    /**
     * A spec this close in X to the left point of a pair counts as belonging to the pair
     * when a splice sits on a vertical wire.
     * Default: 50
     */
    @Positive
    private double nearbySpecXDistance = 50;

    /**
     * A splice lies on a polyline segment when it is this close to the segment's line.
     * Default: 10
     */
    @Positive
    private double spliceOnSegmentTolerance = 10;

    // ---------------------------------------------------------------------
    // Routing paths
    // ---------------------------------------------------------------------

    /**
     * Margin added around the bounding box of all components. Paths with both ends
     * outside the box are decorative or external buses.
     * Default: 20
     */
    @PositiveOrZero
    private double boundsMargin = 20;

    /**
     * Search radius for the connection point at each end of a routing path.
     * Default: 100
     */
    @Positive
    private double endpointSearchRadius = 100;

    /**
     * Search radius for the component at each corner of a rectangular polyline.
     * Default: 15
     */
    @Positive
    private double rectangleCornerRadius = 15;

    /**
     * Y tolerance between a rectangular polyline's longest segment and its spec.
     * Default: 15
     */
    @Positive
    private double rectangleSpecYTolerance = 15;

    /**
     * A rectangular polyline's spec may overhang its longest segment by this much in X.
     * Default: 50
     */
    @PositiveOrZero
    private double rectangleSpecXOverhang = 50;

    /**
     * Segments whose Y (or X) changes by less than this are horizontal (or vertical).
     * Default: 5
     */
    @Positive
    private double segmentAxisTolerance = 5;

    /**
     * Fallback radius between a path vertex and an intermediate splice.
     * Default: 20
     */
    @Positive
    private double vertexSpliceRadius = 20;

    /**
     * A token lies on a routing path segment when it is this close to it.
     * Default: 15
     */
    @Positive
    private double pathPointOnSegmentTolerance = 15;

    /**
     * Specs are printed at most this many units above their wire.
     * Default: 50
     */
    @Positive
    private double specAboveMaxDistance = 50;

    /**
     * Weight applied to the vertical component when scoring spec distance.
     * Default: 2.0
     */
    @Positive
    private double specVerticalWeight = 2.0;

    /**
     * Maximum weighted distance between a wire segment and its spec.
     * Default: 150
     */
    @Positive
    private double specMaxWeightedDistance = 150;

    /**
     * Splices closer than this are never linked directly by a routing path.
     * Default: 400
     */
    @PositiveOrZero
    private double minSpliceLinkDistance = 400;

    // ---------------------------------------------------------------------
    // Ground connections
    // ---------------------------------------------------------------------

    /**
     * Ground labels must sit within this many Y units of the arrow anchor.
     * Default: 20
     */
    @Positive
    private double groundLabelYWindow = 20;

    /**
     * Ground labels and pins must sit within this many X units of the arrow anchor.
     * Default: 210
     */
    @Positive
    private double groundLabelXWindow = 210;

    /**
     * Pins must sit within this many Y units of the arrow anchor.
     * Default: 10
     */
    @Positive
    private double groundPinYWindow = 10;

    /**
     * Candidate pins must sit within this many X units of the arrow anchor.
     * Default: 10
     */
    @Positive
    private double groundPinXWindow = 10;

    /**
     * Maximum X distance between the winning pin's connector label and the ground label.
     * Default: 150
     */
    @Positive
    private double groundLabelPlausibility = 150;

    // ---------------------------------------------------------------------
    // Long routing
    // ---------------------------------------------------------------------

    /**
     * Splices must be farther apart than this to be linked by color flow.
     * Default: 400
     */
    @PositiveOrZero
    private double longRoutingMinDistance = 400;

    /**
     * Splices must differ by more than this in Y to be linked by color flow.
     * Default: 200
     */
    @PositiveOrZero
    private double longRoutingMinVerticalSpan = 200;

    /**
     * A color seen at most this often at a splice, while another color is seen more often,
     * is a minority color and does not trigger a long-routing link.
     * Default: 1
     */
    @PositiveOrZero
    private int minorityColorMaxCount = 1;
}
