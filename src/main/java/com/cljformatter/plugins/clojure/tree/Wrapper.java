package com.cljformatter.plugins.clojure.tree;

import java.util.List;
import java.util.Objects;

/**
 * A reader macro that wraps exactly one form behind a short textual prefix.
 */
public final class Wrapper extends CompositeNode {

    public enum Kind {
        QUOTE("'"),
        SYNTAX_QUOTE("`"),
        UNQUOTE("~"),
        UNQUOTE_SPLICING("~@"),
        VAR_QUOTE("#'"),
        FN("#"),
        UNEVAL("#_"),
        DEREF("@"),
        READER_CONDITIONAL("#?"),
        READER_CONDITIONAL_SPLICING("#?@"),
        EVAL("#=");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }

        public int getPrefixWidth() {
            return prefix.length();
        }
    }

    private final Kind kind;

    public Wrapper(Kind kind, List<Node> children) {
        super(children);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The wrapped form: the last significant child.
     * Stacked uneval markers keep their inner markers as earlier children.
     */
    public Node getTarget() {
        List<Node> significant = getSignificantChildren();
        return significant.isEmpty() ? null : significant.get(significant.size() - 1);
    }

    @Override
    public Wrapper withChildren(List<Node> newChildren) {
        return new Wrapper(kind, newChildren);
    }

    @Override
    public String getOpening() {
        return kind.getPrefix();
    }

    @Override
    public NodeType getType() {
        return NodeType.WRAPPER;
    }
}
