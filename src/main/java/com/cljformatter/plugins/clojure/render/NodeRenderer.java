package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Node;

/**
 * Renders a node whose first character lands at the given zero-based column.
 */
@FunctionalInterface
public interface NodeRenderer {
    Node render(int column, Node node);
}
