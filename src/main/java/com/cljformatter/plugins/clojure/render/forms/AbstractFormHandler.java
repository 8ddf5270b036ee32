package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.FormHandler;
import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.NodeRenderer;
import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Meta;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;

import java.util.List;

/**
 * Shared plumbing for special-form layouts: a cursor over the items after the head, and
 * placement helpers that put any standalone comments on their own lines before the next item.
 */
public abstract class AbstractFormHandler implements FormHandler {

    /** Indentation of body items relative to the opening parenthesis. */
    protected static final int BODY_INDENT = 2;

    protected static final class Cursor {
        private final List<Item> items;
        private int index;

        public Cursor(List<Item> items, int start) {
            this.items = items;
            this.index = start;
        }

        public boolean hasNext() {
            return index < items.size();
        }

        public Item next() {
            return items.get(index++);
        }

        /**
         * The next item that is not a standalone comment, without consuming anything.
         */
        public Item peek() {
            for (int i = index; i < items.size(); i++) {
                if (!items.get(i).isStandaloneComment()) {
                    return items.get(i);
                }
            }
            return null;
        }

        /**
         * Number of items left that are not standalone comments.
         */
        public int remaining() {
            int count = 0;
            for (int i = index; i < items.size(); i++) {
                if (!items.get(i).isStandaloneComment()) {
                    count++;
                }
            }
            return count;
        }
    }

    /**
     * Places the next real item on the current line, after putting any comments in front of it
     * on their own lines at {@code fallbackColumn}.
     */
    protected static Item sameLine(Layout layout, Cursor cursor, int fallbackColumn) {
        return sameLine(layout, cursor, fallbackColumn, null);
    }

    protected static Item sameLine(Layout layout, Cursor cursor, int fallbackColumn, NodeRenderer renderer) {
        Item item = _skipComments(layout, cursor, fallbackColumn);
        if (renderer == null) {
            layout.sameLine(item, fallbackColumn);
        } else {
            layout.sameLine(item, fallbackColumn, renderer);
        }
        return item;
    }

    protected static Item newLine(Layout layout, Cursor cursor, int column) {
        return newLine(layout, cursor, column, null);
    }

    protected static Item newLine(Layout layout, Cursor cursor, int column, NodeRenderer renderer) {
        Item item = _skipComments(layout, cursor, column);
        if (renderer == null) {
            layout.newLine(item, column);
        } else {
            layout.newLine(item, column, renderer);
        }
        return item;
    }

    /**
     * Places every remaining item, comments included, on its own line at {@code column}.
     */
    protected static void restOnNewLines(Layout layout, Cursor cursor, int column) {
        while (cursor.hasNext()) {
            layout.newLine(cursor.next(), column);
        }
    }

    /**
     * Adds the head of a form that keeps its own comments. A trailing comment on the head stays on
     * the head line only when nothing follows it; otherwise it moves to its own line at
     * {@code bodyColumn}.
     */
    protected static void addHead(Layout layout, Cursor cursor, int bodyColumn) {
        Item head = cursor.next();
        if (!head.hasTrailingComment() || !cursor.hasNext()) {
            layout.add(head);
            return;
        }
        layout.add(head.withoutTrailingComment());
        layout.newLine(head.trailingCommentItem(), bodyColumn);
    }

    protected static Collection close(Collection list, Layout layout, int closingColumn) {
        return list.withChildren(layout.finish(closingColumn));
    }

    protected static boolean isKind(Item item, Collection.Kind kind) {
        if (item == null || item.hasPrefix()) {
            return false;
        }
        Node element = item.getElement();
        return element.getType() == NodeType.COLLECTION && ((Collection) element).getKind() == kind;
    }

    /**
     * Like {@link #isKind}, but also true for a collection of that kind under metadata, as in
     * {@code ^String [x]}.
     */
    protected static boolean isHintedKind(Item item, Collection.Kind kind) {
        if (item == null || item.hasPrefix()) {
            return false;
        }
        Node element = item.getElement();
        while (element != null && element.getType() == NodeType.META) {
            element = ((Meta) element).getTarget();
        }
        return element != null && element.getType() == NodeType.COLLECTION
                && ((Collection) element).getKind() == kind;
    }

    protected static boolean isString(Item item) {
        return item != null && item.getElement().getType() == NodeType.ATOM
                && ((Atom) item.getElement()).isString();
    }

    protected static boolean isSymbol(Item item) {
        return item != null && !item.hasPrefix() && item.getElement().getType() == NodeType.ATOM
                && ((Atom) item.getElement()).isSymbol();
    }

    private static Item _skipComments(Layout layout, Cursor cursor, int column) {
        Item item = cursor.next();
        while (item.isStandaloneComment() && cursor.peek() != null) {
            layout.newLine(item, column);
            item = cursor.next();
        }
        return item;
    }
}
