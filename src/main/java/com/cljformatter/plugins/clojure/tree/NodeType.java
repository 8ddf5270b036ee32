package com.cljformatter.plugins.clojure.tree;

/**
 * Tag of every syntax tree node. Renderers switch over this exhaustively.
 */
public enum NodeType {
    ATOM,
    COLLECTION,
    COMMENT,
    WRAPPER,
    META,
    TAGGED,
    FORMS,
    WHITESPACE
}
