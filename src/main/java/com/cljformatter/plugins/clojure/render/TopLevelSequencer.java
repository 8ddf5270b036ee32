package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * Joins rendered top-level items. A standalone comment is followed by a single newline;
 * everything else is separated by one blank line.
 */
public final class TopLevelSequencer {

    private TopLevelSequencer() {
    }

    public static List<Node> sequence(NodeRenderer renderer, List<Item> items) {
        Layout layout = new Layout(renderer, 0);
        Item previous = null;
        for (Item item : items) {
            if (previous != null && previous.isStandaloneComment()) {
                layout.newLine(item, 0);
            } else {
                layout.blankLine(item, 0);
            }
            previous = item;
        }
        return layout.getNodes();
    }
}
