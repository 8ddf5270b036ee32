package com.cljformatter.plugins.clojure.tree;

import java.util.Objects;

/**
 * A leaf token kept with its verbatim source spelling.
 */
public final class Atom extends Node {
    private final String text;

    public Atom(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    public boolean isString() {
        return text.length() >= 2 && text.charAt(0) == '"';
    }

    public boolean isKeyword() {
        return text.startsWith(":");
    }

    /**
     * Symbols are the atoms that are not literals of another kind.
     */
    public boolean isSymbol() {
        if (text.isEmpty()) {
            return false;
        }
        char c = text.charAt(0);
        if (c == '"' || c == ':' || c == '\\' || c == '#' || Character.isDigit(c)) {
            return false;
        }
        if ((c == '+' || c == '-') && text.length() > 1 && Character.isDigit(text.charAt(1))) {
            return false;
        }
        return !text.equals("nil") && !text.equals("true") && !text.equals("false");
    }

    @Override
    public NodeType getType() {
        return NodeType.ATOM;
    }

    @Override
    public void write(StringBuilder sb) {
        sb.append(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Atom)) return false;
        return text.equals(((Atom) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
