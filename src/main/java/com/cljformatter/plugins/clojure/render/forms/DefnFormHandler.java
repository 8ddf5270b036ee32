package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.NodeRenderer;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Meta;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;

import java.util.List;

/**
 * Function and macro definitions.
 * <p>
 * Named variants ({@code defn}, {@code defmacro}) take a name, an optional docstring and an
 * optional attribute map; anonymous variants ({@code fn}) take an optional name only.
 * A single arity keeps its parameter vector on the call line unless a docstring or attribute map
 * pushed the layout onto separate lines. Each arity of a multi-arity definition goes on its own
 * line, except for anonymous functions, which keep the first arity on the definition line and
 * align the others with it.
 */
public class DefnFormHandler extends AbstractFormHandler {
    private final boolean named;

    public DefnFormHandler(boolean named) {
        this.named = named;
    }

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        layout.add(cursor.next());

        Item next = cursor.peek();
        if (next == null) {
            return close(list, layout, body);
        }
        if (named || isSymbol(next)) {
            sameLine(layout, cursor, body);
        }

        boolean separateLines = false;
        if (named) {
            if (isString(cursor.peek()) && cursor.remaining() > 1) {
                newLine(layout, cursor, body);
                separateLines = true;
            }
            if (isKind(cursor.peek(), Collection.Kind.MAP) && cursor.remaining() > 1) {
                newLine(layout, cursor, body);
                separateLines = true;
            }
        }

        next = cursor.peek();
        if (next == null) {
            restOnNewLines(layout, cursor, body);
            return close(list, layout, body);
        }
        if (isHintedKind(next, Collection.Kind.VECTOR)) {
            if (separateLines) {
                newLine(layout, cursor, body);
            } else {
                sameLine(layout, cursor, body);
            }
            restOnNewLines(layout, cursor, body);
            return close(list, layout, body);
        }
        if (isHintedKind(next, Collection.Kind.LIST)) {
            renderArities(renderer, layout, cursor, body, !named);
            return close(list, layout, body);
        }
        return null;
    }

    /**
     * Renders the remaining arity lists of a definition at {@code column}. With
     * {@code firstOnCallLine} the first arity stays on the current line and later ones align with it.
     */
    static void renderArities(Renderer renderer, Layout layout, Cursor cursor, int column, boolean firstOnCallLine) {
        NodeRenderer arity = arityRenderer(renderer);
        int arityColumn = column;
        if (firstOnCallLine) {
            sameLine(layout, cursor, column, arity);
            arityColumn = layout.getElementStart();
        }
        while (cursor.hasNext()) {
            Item item = cursor.next();
            if (item.isStandaloneComment()) {
                layout.newLine(item, arityColumn);
            } else {
                layout.newLine(item, arityColumn, arity);
            }
        }
    }

    /**
     * {@code ([params] body...)}: parameters right after the parenthesis, body items below them.
     * Metadata in front of an arity stays on its line.
     */
    static NodeRenderer arityRenderer(Renderer renderer) {
        return new NodeRenderer() {
            @Override
            public Node render(int column, Node node) {
                if (node.getType() == NodeType.META) {
                    return renderer.renderMeta(column, (Meta) node, this);
                }
                return _renderArity(renderer, column, node);
            }
        };
    }

    private static Node _renderArity(Renderer renderer, int column, Node node) {
        if (node.getType() != NodeType.COLLECTION || !((Collection) node).isList()) {
            return renderer.render(column, node);
        }
        Collection arity = (Collection) node;
        List<Item> items = renderer.items(arity);
        int inner = column + 1;
        Layout layout = new Layout(renderer, inner);
        Cursor cursor = new Cursor(items, 0);
        if (cursor.peek() != null) {
            sameLine(layout, cursor, inner);
        }
        restOnNewLines(layout, cursor, inner);
        return close(arity, layout, inner);
    }
}
