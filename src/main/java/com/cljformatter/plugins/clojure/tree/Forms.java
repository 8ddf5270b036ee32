package com.cljformatter.plugins.clojure.tree;

import java.util.List;

/**
 * Document root: the top-level forms and comments of one source file.
 */
public final class Forms extends CompositeNode {

    public Forms(List<Node> children) {
        super(children);
    }

    @Override
    public Forms withChildren(List<Node> newChildren) {
        return new Forms(newChildren);
    }

    @Override
    public String getOpening() {
        return "";
    }

    @Override
    public NodeType getType() {
        return NodeType.FORMS;
    }
}
