package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.Whitespace;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the rendered children of one form while tracking the output column.
 * <p>
 * Nothing is ever placed after a comment on the same line: an item requested on the same line
 * after a comment, and every standalone comment, moves to a new line at the fallback column.
 */
public final class Layout {
    private final NodeRenderer renderer;
    private final List<Node> nodes = new ArrayList<>();
    private int column;
    private int elementStart;
    private int elementEnd;
    private boolean endsWithComment;
    private boolean empty = true;

    /**
     * @param column column of the first character written by this layout
     */
    public Layout(NodeRenderer renderer, int column) {
        this.renderer = renderer;
        this.column = column;
        this.elementStart = column;
        this.elementEnd = column;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Column of the first character of the most recently rendered element (after any prefix).
     */
    public int getElementStart() {
        return elementStart;
    }

    /**
     * Column just after the most recently rendered element, before its trailing comment.
     */
    public int getElementEnd() {
        return elementEnd;
    }

    public boolean isEmpty() {
        return empty;
    }

    public boolean endsWithComment() {
        return endsWithComment;
    }

    /**
     * Renders an item at the current position with no separator.
     */
    public void add(Item item) {
        add(item, renderer);
    }

    public void add(Item item, NodeRenderer elementRenderer) {
        _renderItem(item, elementRenderer);
    }

    public void sameLine(Item item, int fallbackColumn) {
        sameLine(item, fallbackColumn, renderer);
    }

    /**
     * Places an item one space after the previous one, or on a new line at
     * {@code fallbackColumn} when the line already ends in a comment.
     */
    public void sameLine(Item item, int fallbackColumn, NodeRenderer elementRenderer) {
        if (empty) {
            _renderItem(item, elementRenderer);
        } else if (endsWithComment || item.isStandaloneComment()) {
            newLine(item, fallbackColumn, elementRenderer);
        } else {
            appendSpace();
            _renderItem(item, elementRenderer);
        }
    }

    public void newLine(Item item, int targetColumn) {
        newLine(item, targetColumn, renderer);
    }

    public void newLine(Item item, int targetColumn, NodeRenderer elementRenderer) {
        if (!empty) {
            _break(Whitespace.newline(), targetColumn);
        }
        _renderItem(item, elementRenderer);
    }

    public void blankLine(Item item, int targetColumn) {
        blankLine(item, targetColumn, renderer);
    }

    public void blankLine(Item item, int targetColumn, NodeRenderer elementRenderer) {
        if (!empty) {
            _break(Whitespace.blankLine(), targetColumn);
        }
        _renderItem(item, elementRenderer);
    }

    /**
     * The rendered children so far, without any closing adjustment.
     */
    public List<Node> getNodes() {
        return new ArrayList<>(nodes);
    }

    public void appendSpace() {
        _append(Whitespace.space());
    }

    /**
     * Returns the rendered children. When the last thing written is a comment, a newline and
     * indentation to {@code closingColumn} are added so the closing delimiter can follow.
     */
    public List<Node> finish(int closingColumn) {
        if (endsWithComment) {
            _break(Whitespace.newline(), closingColumn);
            endsWithComment = false;
        }
        return new ArrayList<>(nodes);
    }

    private void _renderItem(Item item, NodeRenderer elementRenderer) {
        if (item.hasPrefix()) {
            _append(item.getPrefix());
            appendSpace();
        }
        elementStart = column;
        Node element = item.getElement();
        _append(element.isComment() ? ((Comment) element).normalized() : elementRenderer.render(column, element));
        elementEnd = column;
        endsWithComment = element.isComment();
        if (item.hasTrailingComment()) {
            appendSpace();
            _append(item.getTrailingComment().normalized());
            endsWithComment = true;
        }
        empty = false;
    }

    private void _break(Whitespace lineBreak, int targetColumn) {
        _append(lineBreak);
        if (targetColumn > 0) {
            _append(Whitespace.spaces(targetColumn));
        }
        endsWithComment = false;
    }

    private void _append(Node node) {
        nodes.add(node);
        String text = node.toSource();
        int newline = text.lastIndexOf('\n');
        column = newline < 0 ? column + text.length() : text.length() - newline - 1;
    }
}
