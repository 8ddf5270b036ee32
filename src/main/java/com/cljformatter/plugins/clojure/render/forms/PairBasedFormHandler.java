package com.cljformatter.plugins.clojure.render.forms;

import com.cljformatter.plugins.clojure.render.Item;
import com.cljformatter.plugins.clojure.render.Layout;
import com.cljformatter.plugins.clojure.render.PairBuilder;
import com.cljformatter.plugins.clojure.render.PairRecord;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-branch conditionals ({@code cond}, {@code case}, {@code condp}...). Leading expressions
 * stay on the call line; clauses are paired, test and result each on their own line, with a
 * blank line between clauses. An unpaired item at the end is the default branch.
 */
public class PairBasedFormHandler extends AbstractFormHandler {
    private final int leading;

    public PairBasedFormHandler(int leading) {
        this.leading = leading;
    }

    @Override
    public Node render(Renderer renderer, Collection list, List<Item> items, int column) {
        int body = column + BODY_INDENT;
        Layout layout = new Layout(renderer, column + 1);
        Cursor cursor = new Cursor(items, 0);
        addHead(layout, cursor, body);
        for (int i = 0; i < leading && cursor.peek() != null; i++) {
            sameLine(layout, cursor, body);
        }

        List<Item> clauses = new ArrayList<>();
        while (cursor.hasNext()) {
            clauses.add(cursor.next());
        }
        PairRecord previous = null;
        for (PairRecord record : PairBuilder.build(clauses)) {
            if (previous == null || previous.getKind() == PairRecord.Kind.COMMENT) {
                layout.newLine(record.getKey(), body);
            } else {
                layout.blankLine(record.getKey(), body);
            }
            if (record.getKind() == PairRecord.Kind.PAIR) {
                layout.newLine(record.getValue(), body);
            }
            previous = record;
        }
        return close(list, layout, body);
    }

    @Override
    public boolean managesOwnComments() {
        return true;
    }
}
