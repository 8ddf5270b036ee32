package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.NodeRenderer;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * {@code let} and friends: the binding vector stays on the call line with one binding pair per
 * line, body items go below. Forms without a binding vector are left to the call layout.
 */
public class BindingFormHandler extends AbstractFormHandler {

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        Cursor cursor = new Cursor(items, 1);
        if (!isKind(cursor.peek(), Collection.Kind.VECTOR)) {
            return null;
        }
        int body = column + BODY_INDENT;
        NodeRenderer bindings = (col, node) -> renderer.renderPaired(col, (Collection) node);

        Layout layout = new Layout(renderer, column + 1);
        layout.add(items.get(0));
        sameLine(layout, cursor, body, bindings);
        restOnNewLines(layout, cursor, body);
        return close(list, layout, body);
    }
}
