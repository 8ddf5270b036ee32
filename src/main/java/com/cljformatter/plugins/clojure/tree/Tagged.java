package com.cljformatter.plugins.clojure.tree;

import java.util.List;

/**
 * Tagged literal such as {@code #inst "2024-01-01"}.
 */
public final class Tagged extends CompositeNode {
    private final String tag;

    public Tagged(String tag, List<Node> children) {
        super(children);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public Tagged withChildren(List<Node> newChildren) {
        return new Tagged(tag, newChildren);
    }

    @Override
    public String getOpening() {
        return tag;
    }

    @Override
    public NodeType getType() {
        return NodeType.TAGGED;
    }
}
