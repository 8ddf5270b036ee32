package com.cljformatter.plugins.clojure.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node with ordered children, written between an opening and a closing text.
 */
public abstract class CompositeNode extends Node {
    private final List<Node> children;

    protected CompositeNode(List<Node> children) {
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public List<Node> getChildren() {
        return children;
    }

    /**
     * Children that are neither noise nor comments.
     */
    public List<Node> getSignificantChildren() {
        List<Node> result = new ArrayList<>();
        for (Node child : children) {
            if (!child.isNoise() && !child.isComment()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Returns a node of the same shape with different children.
     */
    public abstract CompositeNode withChildren(List<Node> newChildren);

    public abstract String getOpening();

    public String getClosing() {
        return "";
    }

    @Override
    public void write(StringBuilder sb) {
        sb.append(getOpening());
        for (Node child : children) {
            child.write(sb);
        }
        sb.append(getClosing());
    }
}
