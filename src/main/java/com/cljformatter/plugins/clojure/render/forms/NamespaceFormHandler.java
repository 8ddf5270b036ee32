package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.NamespaceNormalizer;
import com.cljformatter.plugins.clojure.render.NodeRenderer;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * {@code (ns name ...)}: clauses normalized, then each on its own line. Clause entries render on
 * a single line unless they contain comments.
 */
public class NamespaceFormHandler extends AbstractFormHandler {

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        NodeRenderer clauses = _clauseRenderer(renderer);
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(NamespaceNormalizer.normalize(items), 0);
        layout.add(cursor.next());
        if (cursor.peek() != null) {
            sameLine(layout, cursor, body);
        }
        while (cursor.hasNext()) {
            layout.newLine(cursor.next(), body, clauses);
        }
        return close(list, layout, body);
    }

    private static NodeRenderer _clauseRenderer(Renderer renderer) {
        NodeRenderer entries = (column, node) -> NamespaceNormalizer.containsComment(node)
                ? renderer.render(column, node)
                : NamespaceNormalizer.flat(node);
        return (column, node) -> {
            if (NamespaceNormalizer.clauseKeyword(node) == null) {
                return renderer.render(column, node);
            }
            Collection clause = (Collection) node;
            int inner = column + 1;
            Layout layout = new Layout(renderer, inner);
            Cursor cursor = new Cursor(renderer.items(clause), 0);
            newLine(layout, cursor, inner);
            int entryColumn = layout.getElementEnd() + 1;
            if (cursor.peek() != null) {
                sameLine(layout, cursor, entryColumn, entries);
            }
            while (cursor.hasNext()) {
                Item item = cursor.next();
                if (item.isStandaloneComment()) {
                    layout.newLine(item, entryColumn);
                } else {
                    layout.newLine(item, entryColumn, entries);
                }
            }
            return close(clause, layout, entryColumn);
        };
    }
}
