package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;
import com.cljformatter.plugins.clojure.tree.Whitespace;
import com.cljformatter.plugins.clojure.tree.Wrapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the raw children of a collection into items.
 * <p>
 * Noise is dropped, {@code &} is attached to the element after it, a comment on the same line
 * as the previous element becomes that element's trailing comment, and stacked uneval markers
 * are flattened into sibling items.
 */
public final class ItemGrouper {

    public static final String VARIADIC_MARKER = "&";

    private ItemGrouper() {
    }

    public static List<Item> group(List<Node> children) {
        List<Item> items = new ArrayList<>();
        Atom pendingPrefix = null;
        // the last item may still receive a trailing comment
        boolean sameLine = false;

        for (Node child : _flattenUneval(children)) {
            if (child.isNoise()) {
                if (((Whitespace) child).isNewline()) {
                    sameLine = false;
                }
                continue;
            }
            if (child.isComment()) {
                Comment comment = (Comment) child;
                int last = items.size() - 1;
                if (sameLine && last >= 0 && pendingPrefix == null) {
                    items.set(last, new Item(items.get(last).getElement(), items.get(last).getPrefix(), comment));
                } else {
                    items.add(Item.of(comment));
                }
                sameLine = false;
                continue;
            }
            if (pendingPrefix == null && _isVariadicMarker(child)) {
                pendingPrefix = (Atom) child;
                sameLine = false;
                continue;
            }
            items.add(new Item(child, pendingPrefix, null));
            pendingPrefix = null;
            sameLine = true;
        }
        if (pendingPrefix != null) {
            items.add(Item.of(pendingPrefix));
        }
        return items;
    }

    private static boolean _isVariadicMarker(Node node) {
        return node.getType() == NodeType.ATOM && ((Atom) node).getText().equals(VARIADIC_MARKER);
    }

    /**
     * Replaces every uneval wrapper that owns nested uneval markers with the flattened,
     * left-to-right sequence of single-form uneval wrappers.
     */
    private static List<Node> _flattenUneval(List<Node> children) {
        List<Node> result = new ArrayList<>(children.size());
        for (Node child : children) {
            if (_isUneval(child)) {
                _appendFlattened((Wrapper) child, result);
            } else {
                result.add(child);
            }
        }
        return result;
    }

    private static void _appendFlattened(Wrapper uneval, List<Node> into) {
        List<Node> own = new ArrayList<>();
        Node target = uneval.getTarget();
        for (Node child : uneval.getChildren()) {
            if (child != target && _isUneval(child)) {
                _appendFlattened((Wrapper) child, into);
                into.add(Whitespace.space());
            } else if (!child.isNoise()) {
                own.add(child);
            }
        }
        into.add(own.size() == uneval.getChildren().size() ? uneval : uneval.withChildren(_withNewlines(own)));
    }

    /**
     * Keeps comments inside a rebuilt wrapper on their own lines.
     */
    private static List<Node> _withNewlines(List<Node> nodes) {
        List<Node> result = new ArrayList<>();
        for (Node node : nodes) {
            result.add(node);
            if (node.isComment()) {
                result.add(Whitespace.newline());
            }
        }
        return result;
    }

    private static boolean _isUneval(Node node) {
        return node.getType() == NodeType.WRAPPER && ((Wrapper) node).getKind() == Wrapper.Kind.UNEVAL;
    }
}
