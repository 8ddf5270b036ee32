package com.cljformatter.plugins.clojure.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs up items greedily from left to right, deciding where comments end up.
 * <p>
 * A comment between a key and its value moves in front of the pair. A key's own trailing
 * comment is emitted in front of the pair as well, while a value keeps its trailing comment.
 * A commented item that is not followed by a plain item stays an orphan key.
 */
public final class PairBuilder {

    private PairBuilder() {
    }

    public static List<PairRecord> build(List<Item> items) {
        List<PairRecord> records = new ArrayList<>();
        List<PairRecord> deferred = new ArrayList<>();
        Item pendingKey = null;

        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            if (item.isStandaloneComment()) {
                if (pendingKey == null) {
                    records.add(PairRecord.comment(item));
                } else {
                    deferred.add(PairRecord.comment(item));
                }
                continue;
            }
            if (pendingKey != null) {
                records.addAll(deferred);
                deferred.clear();
                records.add(PairRecord.pair(pendingKey, item));
                pendingKey = null;
                continue;
            }
            if (item.hasTrailingComment()) {
                if (_isPlainItem(items, i + 1)) {
                    records.add(PairRecord.comment(item.trailingCommentItem()));
                    pendingKey = item.withoutTrailingComment();
                } else {
                    records.add(PairRecord.orphanKey(item));
                }
                continue;
            }
            pendingKey = item;
        }

        if (pendingKey != null) {
            records.addAll(deferred);
            records.add(PairRecord.orphanKey(pendingKey));
        }
        return records;
    }

    private static boolean _isPlainItem(List<Item> items, int index) {
        return index < items.size() && !items.get(index).isStandaloneComment();
    }
}
