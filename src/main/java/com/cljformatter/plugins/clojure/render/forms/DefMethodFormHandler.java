package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * {@code (defmethod name dispatch-value [params] body...)}: name, dispatch value and parameters
 * on the call line, body items below. Multi-arity implementations render their arities like
 * {@code defn}.
 */
public class DefMethodFormHandler extends AbstractFormHandler {

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        layout.add(cursor.next());
        if (cursor.remaining() < 2) {
            return null;
        }
        sameLine(layout, cursor, body);
        sameLine(layout, cursor, body);

        Item next = cursor.peek();
        if (isHintedKind(next, Collection.Kind.LIST)) {
            DefnFormHandler.renderArities(renderer, layout, cursor, body, false);
            return close(list, layout, body);
        }
        if (isHintedKind(next, Collection.Kind.VECTOR)) {
            sameLine(layout, cursor, body);
        }
        restOnNewLines(layout, cursor, body);
        return close(list, layout, body);
    }
}
