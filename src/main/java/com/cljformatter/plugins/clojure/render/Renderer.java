package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.CompositeNode;
import com.cljformatter.plugins.clojure.tree.Forms;
import com.cljformatter.plugins.clojure.tree.Meta;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;
import com.cljformatter.plugins.clojure.tree.Tagged;
import com.cljformatter.plugins.clojure.tree.Wrapper;
import com.cljformatter.util.LoggerUtil;

import java.util.List;
import java.util.logging.Logger;

/**
 * Recursive renderer: given the column where a node starts, returns the node rebuilt with the
 * whitespace and newlines of the canonical layout. Input trees are never modified.
 */
public class Renderer implements NodeRenderer {
    private static final Logger logger = LoggerUtil.getLogger(Renderer.class);

    private final SpecialForms specialForms;
    private final CommentHoister hoister;

    public Renderer() {
        this(SpecialForms.standard());
    }

    public Renderer(SpecialForms specialForms) {
        this.specialForms = specialForms;
        this.hoister = new CommentHoister(specialForms);
    }

    @Override
    public Node render(int column, Node node) {
        return switch (node.getType()) {
            case ATOM, WHITESPACE -> node;
            case COMMENT -> ((Comment) node).normalized();
            case COLLECTION -> renderCollection(column, (Collection) node);
            case WRAPPER -> renderWrapper(column, (Wrapper) node);
            case META -> renderMeta(column, (Meta) node, this);
            case TAGGED -> renderTagged(column, (Tagged) node);
            case FORMS -> renderForms((Forms) node);
        };
    }

    public Forms renderForms(Forms forms) {
        List<Item> items = items(forms);
        logger.fine("Rendering " + items.size() + " top-level items");
        return forms.withChildren(TopLevelSequencer.sequence(this, items));
    }

    /**
     * Grouped items of a node's children, with leading comments of nested lists hoisted.
     */
    public List<Item> items(CompositeNode node) {
        return hoister.hoist(ItemGrouper.group(node.getChildren()));
    }

    public Node renderCollection(int column, Collection collection) {
        List<Item> items = items(collection);
        if (collection.isList()) {
            return renderList(column, collection, items);
        }
        return renderGeneric(column, collection, items);
    }

    /**
     * Every item on its own line just inside the opening delimiter; maps pair keys with values.
     */
    public Collection renderGeneric(int column, Collection collection, List<Item> items) {
        int inner = column + collection.getOpenWidth();
        Layout layout = new Layout(this, inner);
        if (collection.getKind() == Collection.Kind.MAP) {
            renderPairs(layout, PairBuilder.build(items), inner);
        } else {
            for (Item item : items) {
                layout.newLine(item, inner);
            }
        }
        return collection.withChildren(layout.finish(inner));
    }

    /**
     * Pairs on successive lines at {@code column}, each value one space after its key.
     */
    public void renderPairs(Layout layout, List<PairRecord> records, int column) {
        for (PairRecord record : records) {
            layout.newLine(record.getKey(), column);
            if (record.getKind() == PairRecord.Kind.PAIR) {
                layout.sameLine(record.getValue(), column);
            }
        }
    }

    /**
     * Renders the collection with {@link #renderPairs}, whatever its kind.
     */
    public Collection renderPaired(int column, Collection collection) {
        int inner = column + collection.getOpenWidth();
        Layout layout = new Layout(this, inner);
        renderPairs(layout, PairBuilder.build(items(collection)), inner);
        return collection.withChildren(layout.finish(inner));
    }

    private Node renderList(int column, Collection list, List<Item> items) {
        if (items.isEmpty()) {
            return renderGeneric(column, list, items);
        }
        FormHandler handler = specialForms.lookup(items.get(0));
        if (handler != null) {
            Node rendered = handler.render(this, list, items, column);
            if (rendered != null) {
                return rendered;
            }
            logger.fine("Atypical special form, rendering as a call: " + items.get(0).getElement().toSource());
        }
        return renderCall(column, list, items);
    }

    /**
     * Call layout: the first argument follows the head, the others align under it.
     */
    public Collection renderCall(int column, Collection list, List<Item> items) {
        int inner = column + 1;
        Layout layout = new Layout(this, inner);
        int index = 0;
        while (index < items.size() && items.get(index).isStandaloneComment()) {
            layout.newLine(items.get(index++), inner);
        }
        if (index == items.size()) {
            return list.withChildren(layout.finish(inner));
        }
        layout.newLine(items.get(index++), inner);
        int argumentColumn = layout.getElementEnd() + 1;
        if (index < items.size()) {
            layout.sameLine(items.get(index++), argumentColumn);
        }
        while (index < items.size()) {
            layout.newLine(items.get(index++), argumentColumn);
        }
        return list.withChildren(layout.finish(argumentColumn));
    }

    private Wrapper renderWrapper(int column, Wrapper wrapper) {
        int inner = column + wrapper.getKind().getPrefixWidth();
        NodeRenderer targetRenderer = this;
        if (wrapper.getKind() == Wrapper.Kind.READER_CONDITIONAL
                || wrapper.getKind() == Wrapper.Kind.READER_CONDITIONAL_SPLICING) {
            targetRenderer = (col, node) -> node.getType() == NodeType.COLLECTION
                    ? renderPaired(col, (Collection) node)
                    : render(col, node);
        }
        Node target = wrapper.getTarget();
        Layout layout = new Layout(this, inner);
        for (Node child : wrapper.getChildren()) {
            if (child.isNoise()) {
                continue;
            }
            if (child == target) {
                layout.sameLine(Item.of(child), inner, targetRenderer);
            } else {
                layout.sameLine(Item.of(child), inner);
            }
        }
        return wrapper.withChildren(layout.finish(inner));
    }

    /**
     * Metadata and its target on one line, the target drawn by {@code targetRenderer}.
     */
    public Meta renderMeta(int column, Meta meta, NodeRenderer targetRenderer) {
        int inner = column + meta.getPrefix().length();
        Node target = meta.getTarget();
        Layout layout = new Layout(this, inner);
        for (Node child : meta.getChildren()) {
            if (child.isNoise()) {
                continue;
            }
            if (child == target) {
                layout.sameLine(Item.of(child), inner, targetRenderer);
            } else {
                layout.sameLine(Item.of(child), inner);
            }
        }
        return meta.withChildren(layout.finish(inner));
    }

    private Tagged renderTagged(int column, Tagged tagged) {
        int inner = column + tagged.getTag().length() + 1;
        Layout layout = new Layout(this, column + tagged.getTag().length());
        layout.appendSpace();
        for (Node child : tagged.getChildren()) {
            if (!child.isNoise()) {
                layout.sameLine(Item.of(child), inner);
            }
        }
        return tagged.withChildren(layout.finish(inner));
    }
}
