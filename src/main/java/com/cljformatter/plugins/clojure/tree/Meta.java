package com.cljformatter.plugins.clojure.tree;

import java.util.List;

/**
 * Metadata attached to a form: {@code ^meta target}.
 */
public final class Meta extends CompositeNode {
    private final String prefix;

    public Meta(String prefix, List<Node> children) {
        super(children);
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * The form the metadata is attached to.
     */
    public Node getTarget() {
        List<Node> significant = getSignificantChildren();
        return significant.isEmpty() ? null : significant.get(significant.size() - 1);
    }

    @Override
    public Meta withChildren(List<Node> newChildren) {
        return new Meta(prefix, newChildren);
    }

    @Override
    public String getOpening() {
        return prefix;
    }

    @Override
    public NodeType getType() {
        return NodeType.META;
    }
}
