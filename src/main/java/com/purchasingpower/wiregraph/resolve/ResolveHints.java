package com.purchasingpower.wiregraph.resolve;

/**
 * Context about the other end of a wire, used to pick between ambiguous connectors.
 *
 * <p>A destination X makes the query a source-side query; a source X makes it a
 * destination-side query. Without either, {@code preferAsSource} decides the role.
 *
 * @param preferAsSource role of the pin when no X hint is given
 * @param sourceX        X of the wire's source, or {@code null}
 * @param destinationX   X of the wire's destination, or {@code null}
 */
public record ResolveHints(boolean preferAsSource, Double sourceX, Double destinationX) {

    private static final ResolveHints NONE = new ResolveHints(false, null, null);

    public static ResolveHints none() {
        return NONE;
    }

    public static ResolveHints asSource(double destinationX) {
        return new ResolveHints(true, null, destinationX);
    }

    public static ResolveHints asDestination(double sourceX) {
        return new ResolveHints(false, sourceX, null);
    }

    public boolean hasSourceHint() {
        return sourceX != null;
    }

    public boolean hasDestinationHint() {
        return destinationX != null;
    }

    public boolean actsAsSource() {
        if (hasDestinationHint()) {
            return true;
        }
        if (hasSourceHint()) {
            return false;
        }
        return preferAsSource;
    }
}
