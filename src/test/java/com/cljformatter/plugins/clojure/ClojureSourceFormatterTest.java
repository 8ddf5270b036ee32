package com.cljformatter.plugins.clojure;

import com.cljformatter.api.error.SyntaxError;
import com.cljformatter.plugins.clojure.reader.ClojureReader;
import com.cljformatter.plugins.clojure.tree.Comment;
import com.cljformatter.plugins.clojure.tree.CompositeNode;
import com.cljformatter.plugins.clojure.tree.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClojureSourceFormatterTest {

    private static String format(String source) throws SyntaxError {
        return ClojureSourceFormatter.formatSource(source);
    }

    static Stream<Arguments> layouts() {
        return Stream.of(
                Arguments.of("(def x 1)", "(def x\n  1)"),
                Arguments.of("(defn f [a b] (+ a b))", "(defn f [a\n         b]\n  (+ a\n     b))"),
                Arguments.of("[1\n  2\n   3]", "[1\n 2\n 3]"),
                Arguments.of("(ns e (:import [java.util Date]) (:require [a.b :as c]))",
                        "(ns e\n  (:require [a.b :as c])\n  (:import (java.util Date)))"),
                Arguments.of("(cond a b c d)", "(cond\n  a\n  b\n\n  c\n  d)"),

                Arguments.of("()", "()"),
                Arguments.of("(foo)", "(foo)"),
                Arguments.of("(foo bar)", "(foo bar)"),
                Arguments.of("(foo a b c)", "(foo a\n     b\n     c)"),
                Arguments.of("((fn [x] x) 1)", "((fn [x]\n   x) 1)"),
                Arguments.of("{:a 1 :b 2}", "{:a 1\n :b 2}"),
                Arguments.of("#{1 2}", "#{1\n  2}"),
                Arguments.of("#:user{:a 1 :b 2}", "#:user{:a 1\n       :b 2}"),
                Arguments.of("'(1 2 3)", "'(1 2\n    3)"),
                Arguments.of("#(+ % 1)", "#(+ %\n    1)"),
                Arguments.of("#?(:clj 1 :cljs 2)", "#?(:clj 1\n   :cljs 2)"),
                Arguments.of("[#_ #_ x y z]", "[#_x\n #_y\n z]"),
                Arguments.of("#inst  \"2020-01-01\"", "#inst \"2020-01-01\""),

                Arguments.of("(def ^:private x 1)", "(def ^:private x\n  1)"),
                Arguments.of("(def x \"Doc.\" 1)", "(def x\n  \"Doc.\"\n  1)"),
                Arguments.of("(defn f \"Doc.\" [x] x)", "(defn f\n  \"Doc.\"\n  [x]\n  x)"),
                Arguments.of("(defn f [a & more] a)", "(defn f [a\n         & more]\n  a)"),
                Arguments.of("(defn f ([x] x) ([x y] y))",
                        "(defn f\n  ([x]\n   x)\n  ([x\n    y]\n   y))"),
                Arguments.of("(fn [x] (inc x))", "(fn [x]\n  (inc x))"),
                Arguments.of("(fn ([x] x) ([x y] y))",
                        "(fn ([x]\n     x)\n    ([x\n      y]\n     y))"),
                Arguments.of("(defn f ^String [x] (str x))", "(defn f ^String [x]\n  (str x))"),
                Arguments.of("(defn f \"Doc.\" ^long [x] x)", "(defn f\n  \"Doc.\"\n  ^long [x]\n  x)"),
                Arguments.of("(fn ^long [x] (inc x))", "(fn ^long [x]\n  (inc x))"),
                Arguments.of("(fn ^:once ([x] x))", "(fn ^:once ([x]\n            x))"),
                Arguments.of("(defmulti area :shape)", "(defmulti area\n  :shape)"),
                Arguments.of("(defmethod area :circle [c] (* c c))",
                        "(defmethod area :circle [c]\n  (* c\n     c))"),
                Arguments.of("(defmethod area :circle ^double [c] (* c c))",
                        "(defmethod area :circle ^double [c]\n  (* c\n     c))"),

                Arguments.of("(let [a 1 b 2] (+ a b))", "(let [a 1\n      b 2]\n  (+ a\n     b))"),
                Arguments.of("(when-let [x (f)] (g x))", "(when-let [x (f)]\n  (g x))"),
                Arguments.of("(clojure.core/let [a 1] a)", "(clojure.core/let [a 1]\n  a)"),
                Arguments.of("(let x y)", "(let x\n     y)"),

                Arguments.of("(if (pos? x) :yes :no)", "(if (pos? x)\n  :yes\n  :no)"),
                Arguments.of("(defprotocol P (m [this]))", "(defprotocol P\n  (m [this]))"),
                Arguments.of("(defrecord R [a b] P (m [this] a))",
                        "(defrecord R [a\n              b]\n  P\n  (m [this]\n     a))"),

                Arguments.of("(case x 1 :a :default)", "(case x\n  1\n  :a\n\n  :default)"),
                Arguments.of("(condp = x 1 :a :b)", "(condp = x\n  1\n  :a\n\n  :b)"),

                Arguments.of("(try (foo) (catch Exception e (bar)) (finally (baz)))",
                        "(try\n  (foo)\n  (catch Exception e\n    (bar))\n  (finally\n    (baz)))"),
                Arguments.of("(do (a) (b))", "(do\n  (a)\n  (b))"),

                Arguments.of("(ns foo \"Doc.\" (:require a))", "(ns foo\n  \"Doc.\"\n  (:require [a]))"),
                Arguments.of("(ns foo (:require b.c (a.b :as ab)) (:import java.util.Date [java.io File]) (:gen-class))",
                        "(ns foo\n"
                                + "  (:gen-class)\n"
                                + "  (:require [a.b :as ab]\n"
                                + "            [b.c])\n"
                                + "  (:import (java.io File)\n"
                                + "           (java.util Date)))"),

                Arguments.of("(def a 1)\n\n\n(def b 2)", "(def a\n  1)\n\n(def b\n  2)"),
                Arguments.of("  \n\n", "")
        );
    }

    @ParameterizedTest
    @MethodSource("layouts")
    void formatsToTheCanonicalLayout(String source, String expected) throws SyntaxError {
        assertEquals(expected, format(source));
    }

    static Stream<Arguments> commentPlacement() {
        return Stream.of(
                Arguments.of("(def x ; the x\n 1)", "(def x ;; the x\n  1)"),
                Arguments.of("(foo a ; c\n b)", "(foo a ;; c\n     b)"),
                Arguments.of("[1 ; one\n]", "[1 ;; one\n ]"),
                Arguments.of("{:a ; key\n 1}", "{;; key\n :a 1}"),
                Arguments.of("{:a 1 ; value\n :b 2}", "{:a 1 ;; value\n :b 2}"),
                Arguments.of("(let [a 1 ; one\n b 2] a)", "(let [a 1 ;; one\n      b 2]\n  a)"),

                // relocated in front of the form
                Arguments.of("(foo ; why\n a b)", ";; why\n(foo a\n     b)"),
                Arguments.of("(foo\n ;; first\n a)", ";; first\n(foo a)"),
                Arguments.of("(;; before\n foo a)", ";; before\n(foo a)"),
                Arguments.of("(foo ; head\n ;; lead\n a)", ";; head\n;; lead\n(foo a)"),
                Arguments.of("(foo (bar ; inner\n x))", ";; inner\n(foo (bar x))"),
                Arguments.of("(foo a (bar ; inner\n x))", "(foo a\n     ;; inner\n     (bar x))"),
                Arguments.of("(foo ; outer\n (bar ; inner\n x))", ";; outer\n;; inner\n(foo (bar x))"),
                Arguments.of("((g ; c\n x) y)", ";; c\n((g x) y)"),
                Arguments.of("((g ; c\n x) ; d\n y)", ";; c\n;; d\n((g x) y)"),
                Arguments.of("[((g ; c\n x))]", "[;; c\n ((g x))]"),
                Arguments.of("(ns (:require a)\n;; s\n(foo))", ";; s\n(ns (foo)\n  (:require [a]))"),
                Arguments.of("(ns (:import java.util.Date)\n;; r\n(:require a))",
                        ";; r\n(ns (:require [a])\n  (:import (java.util Date)))"),

                // kept inside forms that manage their own comments
                Arguments.of("(do ; note\n (a))", "(do\n  ;; note\n  (a))"),
                Arguments.of("(comment ; scratch\n)", "(comment ;; scratch\n  )"),
                Arguments.of("(cond a b\n ;; c\n d e)", "(cond\n  a\n  b\n\n  ;; c\n  d\n  e)"),
                Arguments.of("(case x\n ;; c\n 1 2)", "(case x\n  ;; c\n  1\n  2)"),

                Arguments.of("(def a 1)\n\n\n;; c\n(def b 2)", "(def a\n  1)\n\n;; c\n(def b\n  2)"),
                Arguments.of("(def a 1) ; done", "(def a\n  1) ;; done"),
                Arguments.of(";; a\n\n;; b\n", ";; a\n;; b")
        );
    }

    @ParameterizedTest
    @MethodSource("commentPlacement")
    void placesComments(String source, String expected) throws SyntaxError {
        assertEquals(expected, format(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {"core.clj", "comments.clj", "reader.cljc"})
    void formattingIsIdempotent(String fixture) throws IOException, SyntaxError {
        String once = format(fixture(fixture));
        assertEquals(once, format(once));
    }

    @ParameterizedTest
    @ValueSource(strings = {"core.clj", "comments.clj", "reader.cljc"})
    void everyCommentSurvives(String fixture) throws IOException, SyntaxError {
        String source = fixture(fixture);
        assertEquals(comments(source), comments(format(source)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"core.clj", "comments.clj", "reader.cljc"})
    void noLineEndsInWhitespace(String fixture) throws IOException, SyntaxError {
        String formatted = format(fixture(fixture));
        for (String line : formatted.split("\n", -1)) {
            assertEquals(line.stripTrailing(), line);
        }
        assertFalse(formatted.contains("\n\n\n"), "two consecutive blank lines");
        assertFalse(formatted.endsWith("\n"), "trailing newline");
    }

    @Test
    void canonicalTextIsLeftAlone() throws IOException, SyntaxError {
        String canonical = fixture("canonical.clj").stripTrailing();
        assertEquals(canonical, format(canonical));
    }

    @Test
    void callArgumentsAlignWithTheFirst() throws SyntaxError {
        String formatted = format("(assoc-in m :k :v :extra)");
        String[] lines = formatted.split("\n");
        int column = lines[0].indexOf('m');
        for (int i = 1; i < lines.length; i++) {
            assertEquals(column, lines[i].length() - lines[i].stripLeading().length());
        }
    }

    @Test
    void syntaxErrorsPropagate() {
        SyntaxError error = assertThrows(SyntaxError.class, () -> format("(def x\n  (inc 1)"));
        assertEquals(2, error.getLine());
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = ClojureSourceFormatterTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Sorted comment texts, ignoring marker normalization.
     */
    private static List<String> comments(String source) throws SyntaxError {
        List<String> texts = new ArrayList<>();
        _collectComments(ClojureReader.read(source), texts);
        Collections.sort(texts);
        return texts;
    }

    private static void _collectComments(Node node, List<String> into) {
        if (node.isComment()) {
            into.add(((Comment) node).normalized().getText());
        } else if (node instanceof CompositeNode) {
            for (Node child : ((CompositeNode) node).getChildren()) {
                _collectComments(child, into);
            }
        }
    }
}
