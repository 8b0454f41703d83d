package com.purchasingpower.wiregraph.core;

import java.util.regex.Pattern;

/**
 * Classification of a positioned text label.
 *
 * <p>Kinds are mutually exclusive. {@link #classify(String)} checks the junction shape
 * before the generic connector shape, since every junction name is also a valid
 * connector name.
 *
 * @since 1.0.0
 */
public enum TokenKind {

    /** Pin number below a connector: {@code 7} or {@code 3-4}. */
    PIN,

    /** Splice point: {@code SP123} or a generated {@code SP_CUSTOM_001}. */
    SPLICE,

    /** Connector label. */
    CONNECTOR,

    /** Ground symbol label: {@code G10A(m)}. */
    GROUND,

    /** Wire specification: {@code 0.35,GY/PU}. */
    WIRE_SPEC,

    /** Junction connector named after the two harnesses it joins: {@code MH2FL}. */
    JUNCTION,

    /** Anything else; ignored by the engine. */
    LABEL;

    public static final String CUSTOM_SPLICE_PREFIX = "SP_CUSTOM_";

    private static final Pattern PIN_PATTERN = Pattern.compile("^\\d+(?:-\\d+)?$");
    private static final Pattern SPLICE_PATTERN = Pattern.compile("^SP\\d+$");
    private static final Pattern CUSTOM_SPLICE_PATTERN = Pattern.compile("^SP_CUSTOM_\\d+$");
    private static final Pattern CONNECTOR_PATTERN = Pattern.compile("^[A-Z]{2,4}\\d{1,5}[A-Z_]{0,5}$");
    private static final Pattern OPTION_SUFFIX_PATTERN = Pattern.compile("^(\\S+)\\s+\\([A-Z]{1,3}[+-]?\\)$");
    private static final Pattern DESCRIPTION_PATTERN = Pattern.compile("^GND\\d*$");
    private static final Pattern GROUND_PATTERN = Pattern.compile("^[A-Z_]+\\d+[A-Z_]*\\([a-z]\\)$");
    private static final Pattern WIRE_SPEC_PATTERN = Pattern.compile("^[\\d.]+,[A-Z]{2,}(?:/[A-Z]{2,})?$");
    private static final Pattern JUNCTION_SIDE_PATTERN = Pattern.compile("^[A-Z]{2,3}$");

    public static TokenKind classify(String content) {
        if (content == null) {
            return LABEL;
        }
        String text = content.trim();
        if (text.isEmpty()) {
            return LABEL;
        }
        if (PIN_PATTERN.matcher(text).matches()) {
            return PIN;
        }
        if (isSpliceId(text)) {
            return SPLICE;
        }
        if (GROUND_PATTERN.matcher(text).matches()) {
            return GROUND;
        }
        if (WIRE_SPEC_PATTERN.matcher(text).matches()) {
            return WIRE_SPEC;
        }
        if (isJunctionId(text)) {
            return JUNCTION;
        }
        if (isConnectorLabel(text)) {
            return CONNECTOR;
        }
        return LABEL;
    }

    public static boolean isSpliceId(String id) {
        return id != null
            && (SPLICE_PATTERN.matcher(id).matches() || CUSTOM_SPLICE_PATTERN.matcher(id).matches());
    }

    /**
     * Junction names join two harness codes with a {@code 2}: {@code MH2FL}, {@code FTL2FL}.
     */
    public static boolean isJunctionId(String id) {
        if (id == null || id.length() < 5 || !CONNECTOR_PATTERN.matcher(id).matches()) {
            return false;
        }
        int separator = id.indexOf('2');
        if (separator < 0) {
            return false;
        }
        return JUNCTION_SIDE_PATTERN.matcher(id.substring(0, separator)).matches()
            && JUNCTION_SIDE_PATTERN.matcher(id.substring(separator + 1)).matches();
    }

    /**
     * Mirror of a junction name: {@code MH2FL} becomes {@code FL2MH}.
     */
    public static String mirrorOf(String junctionId) {
        int separator = junctionId.indexOf('2');
        return junctionId.substring(separator + 1) + "2" + junctionId.substring(0, separator);
    }

    private static boolean isConnectorLabel(String text) {
        if (text.contains("\n")) {
            // Shielded pair printed on two lines: every line must name a connector
            for (String line : text.split("\n")) {
                if (!isSingleConnectorLine(line.trim())) {
                    return false;
                }
            }
            return true;
        }
        return isSingleConnectorLine(text);
    }

    private static boolean isSingleConnectorLine(String line) {
        String name = line;
        var option = OPTION_SUFFIX_PATTERN.matcher(line);
        if (option.matches()) {
            name = option.group(1);
        }
        if (name.startsWith("SP") || DESCRIPTION_PATTERN.matcher(name).matches()) {
            return false;
        }
        return CONNECTOR_PATTERN.matcher(name).matches();
    }

    /**
     * Kinds that can terminate a wire directly.
     */
    public boolean isConnectionPoint() {
        return this == PIN || this == SPLICE || this == GROUND;
    }

    /**
     * Kinds that own pins.
     */
    public boolean isConnectorLike() {
        return this == CONNECTOR || this == JUNCTION;
    }
}
