package com.cljformatter.plugins.clojure.render;

import com.cljformatter.api.error.SyntaxError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PairBuilderTest {

    private static String pairs(String collection) throws SyntaxError {
        List<PairRecord> records = PairBuilder.build(ItemGrouperTest.itemsOf(collection));
        return records.stream().map(PairRecord::toString).collect(Collectors.joining(" "));
    }

    @Test
    void pairsGreedilyFromTheLeft() throws SyntaxError {
        assertEquals("Pair[Item[:a] Item[1]] Pair[Item[:b] Item[2]]", pairs("{:a 1 :b 2}"));
    }

    @Test
    void oddItemEndsAsOrphanKey() throws SyntaxError {
        assertEquals("Pair[Item[a] Item[b]] OrphanKey[Item[:default]]", pairs("[a b :default]"));
    }

    @Test
    void commentBetweenKeyAndValueMovesBeforeThePair() throws SyntaxError {
        assertEquals("Comment[Item[;; why]] Pair[Item[:a] Item[1]]", pairs("{:a\n ;; why\n 1}"));
    }

    @Test
    void keyCommentIsEmittedBeforeThePair() throws SyntaxError {
        assertEquals("Comment[Item[; key]] Pair[Item[:a] Item[1]]", pairs("{:a ; key\n 1}"));
    }

    @Test
    void valueKeepsItsTrailingComment() throws SyntaxError {
        assertEquals("Pair[Item[:a] Item[1 ; value]] Pair[Item[:b] Item[2]]", pairs("{:a 1 ; value\n :b 2}"));
    }

    @Test
    void commentedItemWithoutFollowerIsOrphan() throws SyntaxError {
        assertEquals("Pair[Item[a] Item[b]] OrphanKey[Item[c ; last]]", pairs("[a b c ; last\n]"));
    }

    @Test
    void commentedItemFollowedByCommentIsOrphan() throws SyntaxError {
        assertEquals("OrphanKey[Item[a ; one]] Comment[Item[;; two]] Pair[Item[b] Item[c]]",
                pairs("[a ; one\n ;; two\n b c]"));
    }

    @Test
    void deferredCommentsPrecedeAnUnpairedKey() throws SyntaxError {
        assertEquals("Pair[Item[a] Item[b]] Comment[Item[;; tail]] OrphanKey[Item[c]]",
                pairs("[a b c\n ;; tail\n]"));
    }
}
