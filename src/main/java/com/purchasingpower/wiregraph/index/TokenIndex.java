package com.purchasingpower.wiregraph.index;

import com.purchasingpower.wiregraph.core.Token;
import com.purchasingpower.wiregraph.core.TokenKind;
import com.purchasingpower.wiregraph.core.WireSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only index over the classified tokens of one diagram.
 *
 * <p>Tokens keep their input order in every view, so iteration over the index is
 * deterministic.
 *
 * @since 1.0.0
 */
public class TokenIndex {

    private final List<Token> tokens;
    private final Map<TokenKind, List<Token>> byKind = new EnumMap<>(TokenKind.class);
    private final Map<String, Token> firstByContent = new LinkedHashMap<>();
    private final List<WireSpec> wireSpecs;

    public TokenIndex(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        for (TokenKind kind : TokenKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
        for (Token token : this.tokens) {
            byKind.get(token.kind()).add(token);
            firstByContent.putIfAbsent(token.content(), token);
        }
        this.wireSpecs = byKind.get(TokenKind.WIRE_SPEC).stream()
            .map(WireSpec::from)
            .flatMap(Optional::stream)
            .collect(Collectors.toUnmodifiableList());
    }

    public List<Token> all() {
        return tokens;
    }

    public List<Token> allOfKind(TokenKind kind) {
        return Collections.unmodifiableList(byKind.get(kind));
    }

    public List<WireSpec> wireSpecs() {
        return wireSpecs;
    }

    /**
     * Tokens within {@code radius} (Euclidean) of the given position, in input order.
     */
    public List<Token> tokensNear(double x, double y, double radius) {
        List<Token> near = new ArrayList<>();
        for (Token token : tokens) {
            if (Math.hypot(token.x() - x, token.y() - y) <= radius) {
                near.add(token);
            }
        }
        return near;
    }

    /**
     * First token whose content equals the given text.
     */
    public Optional<Token> firstNamed(String content) {
        return Optional.ofNullable(firstByContent.get(content));
    }

    /**
     * Position of every splice, keyed by splice ID. A repeated ID keeps its first position.
     */
    public Map<String, Token> splicePositions() {
        Map<String, Token> positions = new LinkedHashMap<>();
        for (Token splice : byKind.get(TokenKind.SPLICE)) {
            positions.putIfAbsent(splice.content(), splice);
        }
        return positions;
    }

    /**
     * Bounding box of all components (connectors, junctions, pins, splices and grounds)
     * grown by {@code margin} on every side, or empty when the diagram has no components.
     */
    public Optional<Bounds> componentBounds(double margin) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        boolean found = false;

        for (Token token : tokens) {
            if (token.kind().isConnectionPoint() || token.kind().isConnectorLike()) {
                minX = Math.min(minX, token.x());
                minY = Math.min(minY, token.y());
                maxX = Math.max(maxX, token.x());
                maxY = Math.max(maxY, token.y());
                found = true;
            }
        }
        if (!found) {
            return Optional.empty();
        }
        return Optional.of(new Bounds(minX - margin, minY - margin, maxX + margin, maxY + margin));
    }

    /**
     * Axis-aligned rectangle.
     */
    public record Bounds(double minX, double minY, double maxX, double maxY) {

        public boolean contains(double x, double y) {
            return x >= minX && x <= maxX && y >= minY && y <= maxY;
        }
    }
}
