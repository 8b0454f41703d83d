package com.purchasingpower.wiregraph.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Drawing conventions of the diagram family being processed.
 *
 * <p>Covers the naming code of the home harness used for junction labels and the
 * style classes the drawing tool assigns to each layer of the exported SVG.
 *
 * <pre>
 * wiregraph:
 *   conventions:
 *     junction-code: FL
 *     routing-wire-classes: [st1]
 *     staircase-routing-classes: [st3, st4]
 *     ground-arrow-classes: [st17]
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "wiregraph.conventions")
public class DiagramConventions {

    /**
     * Harness code that junction labels are named against. {@code MH2FL} leads into the
     * home harness (destination side), {@code FL2MH} leads out of it (source side).
     */
    @NotBlank
    private String junctionCode = "FL";

    /**
     * Path classes of the white routing wires.
     */
    @NotEmpty
    private List<String> routingWireClasses = new ArrayList<>(List.of("st1"));

    /**
     * Path classes of L-shaped (staircase) routing; only paths with a vertical command are taken.
     */
    @NotEmpty
    private List<String> staircaseRoutingClasses = new ArrayList<>(List.of("st3", "st4"));

    /**
     * Path classes of the ground arrow heads.
     */
    @NotEmpty
    private List<String> groundArrowClasses = new ArrayList<>(List.of("st17"));

    /** Splice dots are short unclassed paths. */
    @Positive
    private int spliceDotMaxPathLength = 200;

    /** Minimum number of cubic curve commands in a splice dot. */
    @Positive
    private int spliceDotMinCurveCommands = 3;

    /** Maximum distance between a splice label and its dot. */
    @Positive
    private double spliceLabelRadius = 35;

    /** Maximum X distance from a connector label to its {@code (XR-)} option label. */
    @Positive
    private double optionLabelMaxXDistance = 30;

    /** Maximum Y distance from a connector label to its option label. */
    @Positive
    private double optionLabelYTolerance = 3;

    /** Maximum X distance between the two halves of a shielded connector pair. */
    @Positive
    private double shieldedPairMaxXDistance = 30;

    /** Minimum Y gap between the two halves of a shielded connector pair. */
    @Positive
    private double shieldedPairMinYGap = 5;

    /** Maximum Y gap between the two halves of a shielded connector pair. */
    @Positive
    private double shieldedPairMaxYGap = 20;

    /** Polylines whose points all lie this close (Manhattan) to another's are outline duplicates. */
    @Positive
    private double polylineDuplicateTolerance = 2;
}
