package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.Collection;
import com.cljformatter.plugins.clojure.tree.CompositeNode;
import com.cljformatter.plugins.clojure.tree.Node;
import com.cljformatter.plugins.clojure.tree.NodeType;
import com.cljformatter.plugins.clojure.tree.Whitespace;
import com.cljformatter.util.LoggerUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Canonical order and shape for the clauses of an {@code ns} form.
 * <p>
 * Clauses other than require and import keep their order and come first, then the require-like
 * clauses, then the import clauses. Entries of require clauses become vectors and entries of
 * import clauses become lists, and both are sorted by their single-line text. Comments travel
 * with the clause or entry that follows them.
 */
public final class NamespaceNormalizer {
    private static final Logger logger = LoggerUtil.getLogger(NamespaceNormalizer.class);

    public static final String NS = "ns";

    private static final Set<String> REQUIRE_CLAUSES = new HashSet<>(
            Arrays.asList(":require", ":require-macros", ":use", ":use-macros"));
    private static final String IMPORT_CLAUSE = ":import";

    private NamespaceNormalizer() {
    }

    /**
     * Normalizes the items of an {@code ns} list, head included. Items of any other list are
     * returned unchanged.
     */
    public static List<Item> normalize(List<Item> items) {
        if (items.isEmpty() || !(items.get(0).isAtom(NS) || items.get(0).isAtom("clojure.core/" + NS))) {
            return items;
        }
        List<Item> header = new ArrayList<>();
        List<Item> others = new ArrayList<>();
        List<Item> requires = new ArrayList<>();
        List<Item> imports = new ArrayList<>();
        List<Item> pendingComments = new ArrayList<>();
        boolean inClauses = false;

        for (Item item : items) {
            if (item.isStandaloneComment()) {
                pendingComments.add(item);
                continue;
            }
            String clause = clauseKeyword(item.getElement());
            if (clause == null && !inClauses) {
                header.addAll(pendingComments);
                header.add(item);
            } else if (REQUIRE_CLAUSES.contains(clause)) {
                inClauses = true;
                requires.addAll(pendingComments);
                requires.addAll(_normalizeClause(item, false));
            } else if (IMPORT_CLAUSE.equals(clause)) {
                inClauses = true;
                imports.addAll(pendingComments);
                imports.addAll(_normalizeClause(item, true));
            } else {
                inClauses = true;
                others.addAll(pendingComments);
                others.add(item);
            }
            pendingComments.clear();
        }

        List<Item> result = new ArrayList<>(header);
        result.addAll(others);
        result.addAll(requires);
        result.addAll(imports);
        result.addAll(pendingComments);
        if (!_sameOrder(items, result)) {
            logger.fine("Reordered namespace clauses of " + _name(items));
        }
        return result;
    }

    /**
     * Keyword heading a clause list such as {@code (:require ...)}, or {@code null}.
     */
    public static String clauseKeyword(Node node) {
        if (node.getType() != NodeType.COLLECTION || !((Collection) node).isList()) {
            return null;
        }
        List<Node> children = ((Collection) node).getSignificantChildren();
        if (children.isEmpty() || children.get(0).getType() != NodeType.ATOM) {
            return null;
        }
        Atom head = (Atom) children.get(0);
        return head.isKeyword() ? head.getText() : null;
    }

    /**
     * The node on a single line: noise replaced by single spaces. Used for clause entries and as
     * the sort key of entries.
     */
    public static Node flat(Node node) {
        if (!(node instanceof CompositeNode)) {
            return node;
        }
        CompositeNode composite = (CompositeNode) node;
        List<Node> children = new ArrayList<>();
        if (node.getType() == NodeType.TAGGED) {
            children.add(Whitespace.space());
        }
        boolean first = true;
        for (Node child : composite.getSignificantChildren()) {
            if (!first) {
                children.add(Whitespace.space());
            }
            children.add(flat(child));
            first = false;
        }
        return composite.withChildren(children);
    }

    public static boolean containsComment(Node node) {
        if (node.isComment()) {
            return true;
        }
        if (node instanceof CompositeNode) {
            for (Node child : ((CompositeNode) node).getChildren()) {
                if (containsComment(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns the rebuilt clause, preceded by the comments that would otherwise end up between
     * the clause keyword and its first entry.
     */
    private static List<Item> _normalizeClause(Item clauseItem, boolean importClause) {
        Collection clause = (Collection) clauseItem.getElement();
        List<Item> items = ItemGrouper.group(clause.getChildren());

        List<Item> lifted = new ArrayList<>();
        int index = 0;
        while (items.get(index).isStandaloneComment()) {
            lifted.add(items.get(index++));
        }
        Item keyword = items.get(index++);
        if (keyword.hasTrailingComment()) {
            lifted.add(keyword.trailingCommentItem());
            keyword = keyword.withoutTrailingComment();
        }
        List<Item> result = new ArrayList<>();
        result.add(keyword);

        List<List<Item>> entries = new ArrayList<>();
        List<Item> current = new ArrayList<>();
        for (; index < items.size(); index++) {
            Item item = items.get(index);
            if (item.isStandaloneComment()) {
                current.add(item);
                continue;
            }
            Node element = importClause ? _importEntry(item.getElement()) : _requireEntry(item.getElement());
            current.add(item.withElement(element));
            entries.add(current);
            current = new ArrayList<>();
        }
        entries.sort(Comparator.comparing(NamespaceNormalizer::_sortKey));
        if (!entries.isEmpty()) {
            List<Item> first = entries.get(0);
            lifted.addAll(first.subList(0, first.size() - 1));
            result.add(first.get(first.size() - 1));
            entries.remove(0);
        } else {
            lifted.addAll(current);
            current.clear();
        }
        for (List<Item> entry : entries) {
            result.addAll(entry);
        }
        result.addAll(current);
        lifted.add(clauseItem.withElement(clause.withChildren(Item.toNodes(result))));
        return lifted;
    }

    private static String _sortKey(List<Item> entry) {
        return flat(entry.get(entry.size() - 1).getElement()).toSource();
    }

    /**
     * {@code a.b} and {@code (a.b :as c)} become vectors; prefix lists keep their list shape.
     */
    private static Node _requireEntry(Node entry) {
        if (entry.getType() == NodeType.ATOM && ((Atom) entry).isSymbol()) {
            return new Collection(Collection.Kind.VECTOR, List.of(entry));
        }
        if (entry.getType() == NodeType.COLLECTION && ((Collection) entry).isList() && !_isPrefixList((Collection) entry)) {
            return new Collection(Collection.Kind.VECTOR, ((Collection) entry).getChildren());
        }
        return entry;
    }

    /**
     * {@code [java.util Date]} becomes a list and {@code java.util.Date} becomes
     * {@code (java.util Date)}.
     */
    private static Node _importEntry(Node entry) {
        if (entry.getType() == NodeType.COLLECTION && ((Collection) entry).getKind() == Collection.Kind.VECTOR) {
            return new Collection(Collection.Kind.LIST, ((Collection) entry).getChildren());
        }
        if (entry.getType() == NodeType.ATOM && ((Atom) entry).isSymbol()) {
            String text = ((Atom) entry).getText();
            int dot = text.lastIndexOf('.');
            if (dot > 0 && dot < text.length() - 1) {
                return new Collection(Collection.Kind.LIST, List.of(
                        new Atom(text.substring(0, dot)), Whitespace.space(), new Atom(text.substring(dot + 1))));
            }
        }
        return entry;
    }

    /**
     * A prefix list names a namespace prefix followed by lib specs, e.g.
     * {@code (clojure [string :as str] set)}, where a lib spec has options after its name.
     */
    private static boolean _isPrefixList(Collection list) {
        List<Node> children = list.getSignificantChildren();
        if (children.size() < 2) {
            return false;
        }
        Node second = children.get(1);
        return second.getType() != NodeType.ATOM || !((Atom) second).isKeyword();
    }

    private static boolean _sameOrder(List<Item> before, List<Item> after) {
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i < before.size(); i++) {
            if (!before.get(i).getElement().toSource().equals(after.get(i).getElement().toSource())) {
                return false;
            }
        }
        return true;
    }

    private static String _name(List<Item> items) {
        return items.size() > 1 ? items.get(1).getElement().toSource() : "<unnamed>";
    }
}
