package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;
import com.cljformatter.plugins.clojure.tree.Whitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A significant element of a sequence, together with an optional variadic prefix ({@code &})
 * and an optional comment that followed it on the same source line.
 * A standalone comment is an item whose element is the comment itself.
 */
public final class Item {
    private final Node element;
    private final Atom prefix;
    private final Comment trailingComment;

    public Item(Node element, Atom prefix, Comment trailingComment) {
        this.element = Objects.requireNonNull(element, "element");
        this.prefix = prefix;
        this.trailingComment = trailingComment;
    }

    public static Item of(Node element) {
        return new Item(element, null, null);
    }

    public Node getElement() {
        return element;
    }

    public Atom getPrefix() {
        return prefix;
    }

    public Comment getTrailingComment() {
        return trailingComment;
    }

    public boolean hasPrefix() {
        return prefix != null;
    }

    public boolean hasTrailingComment() {
        return trailingComment != null;
    }

    public boolean isStandaloneComment() {
        return element.isComment();
    }

    /**
     * True for a plain atom element whose text is one of the given names.
     */
    public boolean isAtom(String text) {
        return element.getType() == NodeType.ATOM && ((Atom) element).getText().equals(text);
    }

    public Item withElement(Node newElement) {
        return new Item(newElement, prefix, trailingComment);
    }

    public Item withoutTrailingComment() {
        return trailingComment == null ? this : new Item(element, prefix, null);
    }

    /**
     * Standalone item for this item's trailing comment.
     */
    public Item trailingCommentItem() {
        return Item.of(trailingComment);
    }

    /**
     * Expands items back into raw children, one item per line, so that grouping the result
     * yields the same items again.
     */
    public static List<Node> toNodes(List<Item> items) {
        List<Node> nodes = new ArrayList<>();
        for (Item item : items) {
            if (!nodes.isEmpty()) {
                nodes.add(Whitespace.newline());
            }
            if (item.prefix != null) {
                nodes.add(item.prefix);
                nodes.add(Whitespace.space());
            }
            nodes.add(item.element);
            if (item.trailingComment != null) {
                nodes.add(Whitespace.space());
                nodes.add(item.trailingComment);
            }
        }
        if (!items.isEmpty() && _endsWithComment(items.get(items.size() - 1))) {
            nodes.add(Whitespace.newline());
        }
        return nodes;
    }

    private static boolean _endsWithComment(Item item) {
        return item.trailingComment != null || item.element.isComment();
    }

    @Override
    public String toString() {
        return "Item[" + (prefix == null ? "" : prefix.getText() + " ") + element.toSource()
                + (trailingComment == null ? "" : " " + trailingComment.getText()) + "]";
    }
}
