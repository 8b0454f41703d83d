package com.purchasingpower.wiregraph.core;

/**
 * Positioned text label of the diagram. The kind is classified once, on creation.
 *
 * @param content raw label text, trimmed; shielded pairs keep their line break
 * @param x       anchor X of the label
 * @param y       anchor Y (baseline) of the label
 * @param kind    classification of the content
 */
public record Token(String content, double x, double y, TokenKind kind) {

    public static Token of(String content, double x, double y) {
        String text = content == null ? "" : content.trim();
        return new Token(text, x, y, TokenKind.classify(text));
    }

    public Point position() {
        return new Point(x, y);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }
}
