package com.cljformatter.plugins.clojure.tree;

/**
 * Base class of the comment-preserving syntax tree.
 * Nodes are immutable; every transformation builds new nodes.
 */
public abstract class Node {

    public abstract NodeType getType();

    /**
     * Appends the exact source text of this node.
     */
    public abstract void write(StringBuilder sb);

    public String toSource() {
        StringBuilder sb = new StringBuilder();
        write(sb);
        return sb.toString();
    }

    /**
     * Whitespace, newlines and commas.
     */
    public boolean isNoise() {
        return false;
    }

    public boolean isComment() {
        return false;
    }

    @Override
    public String toString() {
        return getType() + "[" + toSource() + "]";
    }
}
