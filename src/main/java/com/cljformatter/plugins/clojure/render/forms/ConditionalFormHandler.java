package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * A fixed number of leading items on the call line, everything else on its own line.
 */
public class ConditionalFormHandler extends AbstractFormHandler {
    private final int leading;

    public ConditionalFormHandler(int leading) {
        this.leading = leading;
    }

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        layout.add(cursor.next());
        for (int i = 0; i < leading && cursor.peek() != null; i++) {
            sameLine(layout, cursor, body);
        }
        restOnNewLines(layout, cursor, body);
        return close(list, layout, body);
    }
}
