package com.cljformatter.plugins.clojure.tree;

import java.util.Objects;

/**
 * A line comment without its line terminator.
 */
public final class Comment extends Node {
    private final String text;

    public Comment(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    /**
     * Returns the canonical spelling: a single leading {@code ;} becomes {@code ;;}
     * and trailing whitespace is dropped.
     */
    public Comment normalized() {
        String normalized = text.stripTrailing();
        if (normalized.startsWith(";") && !normalized.startsWith(";;")) {
            normalized = ";" + normalized;
        }
        return normalized.equals(text) ? this : new Comment(normalized);
    }

    @Override
    public NodeType getType() {
        return NodeType.COMMENT;
    }

    @Override
    public boolean isComment() {
        return true;
    }

    @Override
    public void write(StringBuilder sb) {
        sb.append(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comment)) return false;
        return text.equals(((Comment) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
