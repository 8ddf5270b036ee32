package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * {@code (def name "doc"? value)}: the name stays on the call line, the docstring and the value
 * each go on their own line. Also used for {@code defmulti}, whose dispatch function and options
 * take the place of the value.
 */
public class DefFormHandler extends AbstractFormHandler {

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        layout.add(cursor.next());
        if (cursor.peek() != null) {
            sameLine(layout, cursor, body);
        }
        restOnNewLines(layout, cursor, body);
        return close(list, layout, body);
    }
}
