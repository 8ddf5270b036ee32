package com.cljformatter.plugins.clojure.tree;

/**
 * Structural noise between significant nodes. Dropped by grouping and regenerated by rendering.
 */
public final class Whitespace extends Node {

    public enum Kind {
        SPACE,
        NEWLINE,
        COMMA
    }

    private static final Whitespace NEWLINE = new Whitespace(Kind.NEWLINE, "\n");
    private static final Whitespace BLANK_LINE = new Whitespace(Kind.NEWLINE, "\n\n");
    private static final Whitespace ONE_SPACE = new Whitespace(Kind.SPACE, " ");

    private final Kind kind;
    private final String text;

    public Whitespace(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static Whitespace newline() {
        return NEWLINE;
    }

    public static Whitespace blankLine() {
        return BLANK_LINE;
    }

    public static Whitespace space() {
        return ONE_SPACE;
    }

    public static Whitespace spaces(int count) {
        return count == 1 ? ONE_SPACE : new Whitespace(Kind.SPACE, " ".repeat(count));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNewline() {
        return kind == Kind.NEWLINE;
    }

    @Override
    public NodeType getType() {
        return NodeType.WHITESPACE;
    }

    @Override
    public boolean isNoise() {
        return true;
    }

    @Override
    public void write(StringBuilder sb) {
        sb.append(text);
    }
}
