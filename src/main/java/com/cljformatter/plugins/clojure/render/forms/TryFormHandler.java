package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.NodeRenderer;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;

import java.util.List;

/**
 * {@code (try body... (catch Class e body...) (finally body...))}. Clause headers stay on one
 * line and clause bodies are indented one step further than the try body.
 */
public class TryFormHandler extends AbstractFormHandler {
    private static final String CATCH = "catch";
    private static final String FINALLY = "finally";

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        NodeRenderer clauses = _clauseRenderer(renderer);
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        layout.add(cursor.next());
        while (cursor.hasNext()) {
            layout.newLine(cursor.next(), body, clauses);
        }
        return close(list, layout, body);
    }

    private static NodeRenderer _clauseRenderer(Renderer renderer) {
        return (column, node) -> {
            String clause = _clauseName(node);
            if (clause == null) {
                return renderer.render(column, node);
            }
            Collection list = (Collection) node;
            int clauseBody = column + BODY_INDENT;
            Layout layout = new Layout(renderer, column + 1);
            Cursor cursor = new Cursor(renderer.items(list), 0);
            layout.add(cursor.next());
            int header = clause.equals(CATCH) ? 2 : 0;
            for (int i = 0; i < header && cursor.peek() != null; i++) {
                sameLine(layout, cursor, clauseBody);
            }
            restOnNewLines(layout, cursor, clauseBody);
            return close(list, layout, clauseBody);
        };
    }

    /**
     * {@code catch} or {@code finally} when the node is such a clause with its keyword first.
     */
    private static String _clauseName(Node node) {
        if (node.getType() != NodeType.COLLECTION || !((Collection) node).isList()) {
            return null;
        }
        List<Node> children = ((Collection) node).getSignificantChildren();
        if (children.isEmpty() || children.get(0).getType() != NodeType.ATOM) {
            return null;
        }
        String text = ((Atom) children.get(0)).getText();
        return text.equals(CATCH) || text.equals(FINALLY) ? text : null;
    }
}
