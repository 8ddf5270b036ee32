package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * Body-only forms such as {@code do} and {@code comment}: every item on its own line.
 */
public class BodyFormHandler extends AbstractFormHandler {

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        addHead(layout, cursor, body);
        restOnNewLines(layout, cursor, body);
        return close(list, layout, body);
    }

    @Override
    public boolean managesOwnComments() {
        return true;
    }
}
