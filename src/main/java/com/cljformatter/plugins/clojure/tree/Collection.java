package com.cljformatter.plugins.clojure.tree;

import java.util.List;
import java.util.Objects;

/**
 * List, vector, map or set.
 */
public final class Collection extends CompositeNode {

    public enum Kind {
        LIST("(", ")"),
        VECTOR("[", "]"),
        MAP("{", "}"),
        SET("#{", "}");

        private final String open;
        private final String close;

        Kind(String open, String close) {
            this.open = open;
            this.close = close;
        }

        public String getOpen() {
            return open;
        }

        public String getClose() {
            return close;
        }
    }

    private final Kind kind;
    private final String prefix;

    public Collection(Kind kind, List<Node> children) {
        this(kind, "", children);
    }

    /**
     * @param prefix namespace prefix of a namespaced map such as {@code #:user}, otherwise empty
     */
    public Collection(Kind kind, String prefix, List<Node> children) {
        super(children);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.prefix = prefix == null ? "" : prefix;
    }

    public Kind getKind() {
        return kind;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isList() {
        return kind == Kind.LIST;
    }

    /**
     * Width of everything written before the first child.
     */
    public int getOpenWidth() {
        return prefix.length() + kind.getOpen().length();
    }

    @Override
    public Collection withChildren(List<Node> newChildren) {
        return new Collection(kind, prefix, newChildren);
    }

    @Override
    public String getOpening() {
        return prefix + kind.getOpen();
    }

    @Override
    public String getClosing() {
        return kind.getClose();
    }

    @Override
    public NodeType getType() {
        return NodeType.COLLECTION;
    }
}
