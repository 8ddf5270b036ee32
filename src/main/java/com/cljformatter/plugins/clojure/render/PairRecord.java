package com.cljformatter.plugins.clojure.render;

/**
 * Output of {@link PairBuilder}: a key/value pair, a relocated or standalone comment,
 * or a key that has no value.
 */
public final class PairRecord {

    public enum Kind {
        PAIR,
        COMMENT,
        ORPHAN_KEY
    }

    private final Kind kind;
    private final Item key;
    private final Item value;

    private PairRecord(Kind kind, Item key, Item value) {
        this.kind = kind;
        this.key = key;
        this.value = value;
    }

    public static PairRecord pair(Item key, Item value) {
        return new PairRecord(Kind.PAIR, key, value);
    }

    public static PairRecord comment(Item comment) {
        return new PairRecord(Kind.COMMENT, comment, null);
    }

    public static PairRecord orphanKey(Item key) {
        return new PairRecord(Kind.ORPHAN_KEY, key, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The key of a pair, the comment item of a comment record, or the orphan item.
     */
    public Item getKey() {
        return key;
    }

    /**
     * The value of a pair; {@code null} for other records.
     */
    public Item getValue() {
        return value;
    }

    @Override
    public String toString() {
        switch (kind) {
            case PAIR:
                return "Pair[" + key + " " + value + "]";
            case COMMENT:
                return "Comment[" + key + "]";
            default:
                return "OrphanKey[" + key + "]";
        }
    }
}
