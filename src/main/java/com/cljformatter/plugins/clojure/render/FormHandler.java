package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Node;

import java.util.List;

/**
 * Layout rule for a special form, selected by the symbol at the head of a list.
 */
public interface FormHandler {

    /**
     * Renders the list.
     *
     * @param renderer renderer for nested nodes
     * @param list the original list
     * @param items grouped items of the list; the head is the first item
     * @param column column of the opening parenthesis
     * @return the rendered list, or {@code null} when the form does not have the expected shape
     *         and should be rendered as a plain call
     */
    Node render(Renderer renderer, Collection list, List<Item> items, int column);

    /**
     * Whether comments after the head stay inside the form instead of being hoisted in front of it.
     */
    default boolean managesOwnComments() {
        return false;
    }
}
