package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Moves the comments that sit between the start of a list and its first real argument in
 * front of the list, as standalone items of the enclosing sequence.
 * <p>
 * Hoisted are the comments before the head, the head's trailing comment and standalone comments
 * before the first argument. When the head or the first argument is itself a list, its hoistable
 * comments travel through as well, so a second pass finds nothing left to move. Forms whose
 * handler manages its own comments only give up the comments before their head. The clauses of
 * an {@code ns} form are put in their canonical order first, so that comments which ordering
 * brings to the front of the form leave it in the same pass.
 */
public final class CommentHoister {
    private final SpecialForms specialForms;

    public CommentHoister(SpecialForms specialForms) {
        this.specialForms = specialForms;
    }

    public List<Item> hoist(List<Item> items) {
        List<Item> result = null;
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            Extraction extraction = _hoistable(item) ? _extract((Collection) item.getElement()) : null;
            if (extraction == null || extraction.comments.isEmpty()) {
                if (result != null) {
                    result.add(item);
                }
                continue;
            }
            if (result == null) {
                result = new ArrayList<>(items.subList(0, i));
            }
            for (Comment comment : extraction.comments) {
                result.add(Item.of(comment));
            }
            result.add(item.withElement(extraction.list));
        }
        return result == null ? items : result;
    }

    private static boolean _hoistable(Item item) {
        Node element = item.getElement();
        return !item.hasPrefix()
                && element.getType() == NodeType.COLLECTION
                && ((Collection) element).isList();
    }

    private Extraction _extract(Collection list) {
        List<Item> items = ItemGrouper.group(list.getChildren());
        int headIndex = 0;
        while (headIndex < items.size() && items.get(headIndex).isStandaloneComment()) {
            headIndex++;
        }
        if (headIndex == items.size()) {
            return new Extraction(Collections.emptyList(), list);
        }
        List<Item> normalized = new ArrayList<>(items.subList(0, headIndex));
        normalized.addAll(NamespaceNormalizer.normalize(items.subList(headIndex, items.size())));
        items = normalized;

        List<Comment> hoisted = new ArrayList<>();
        for (int i = 0; i < headIndex; i++) {
            hoisted.add((Comment) items.get(i).getElement());
        }

        List<Item> kept = new ArrayList<>();
        Item head = items.get(headIndex);
        int index = headIndex + 1;
        if (specialForms.managesOwnComments(head)) {
            kept.add(head);
        } else {
            if (_hoistable(head)) {
                Extraction inner = _extract((Collection) head.getElement());
                hoisted.addAll(inner.comments);
                head = head.withElement(inner.list);
            }
            if (head.hasTrailingComment()) {
                hoisted.add(head.getTrailingComment());
                head = head.withoutTrailingComment();
            }
            kept.add(head);
            while (index < items.size() && items.get(index).isStandaloneComment()) {
                hoisted.add((Comment) items.get(index).getElement());
                index++;
            }
            if (index < items.size()) {
                Item first = items.get(index);
                if (_hoistable(first)) {
                    Extraction inner = _extract((Collection) first.getElement());
                    hoisted.addAll(inner.comments);
                    first = first.withElement(inner.list);
                }
                kept.add(first);
                index++;
            }
        }
        kept.addAll(items.subList(index, items.size()));

        if (hoisted.isEmpty()) {
            return new Extraction(hoisted, list);
        }
        return new Extraction(hoisted, list.withChildren(Item.toNodes(kept)));
    }

    private static final class Extraction {
        private final List<Comment> comments;
        private final Collection list;

        private Extraction(List<Comment> comments, Collection list) {
            this.comments = comments;
            this.list = list;
        }
    }
}
