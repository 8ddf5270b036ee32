package com.cljformatter.plugins.clojure;

import com.cljformatter.api.error.SyntaxError;
import com.cljformatter.plugins.clojure.reader.ClojureReader;
import com.cljformatter.plugins.clojure.render.Renderer;
import com.cljformatter.plugins.clojure.tree.Forms;

/**
 * Entry point of the formatting engine: source text in, canonical source text out.
 */
public final class ClojureSourceFormatter {

    private ClojureSourceFormatter() {
    }

    /**
     * Formats a whole source file. The result has no trailing newline.
     *
     * @throws SyntaxError when the text cannot be read
     */
    public static String formatSource(String text) throws SyntaxError {
        Forms forms = ClojureReader.read(text);
        return new Renderer().renderForms(forms).toSource();
    }
}
