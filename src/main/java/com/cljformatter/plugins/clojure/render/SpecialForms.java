package com.cljformatter.plugins.clojure.render;

import com.cljformatter.plugins.clojure.render.forms.BindingFormHandler;
import com.cljformatter.plugins.clojure.render.forms.BodyFormHandler;
import com.cljformatter.plugins.clojure.render.forms.ConditionalFormHandler;
import com.cljformatter.plugins.clojure.render.forms.DefFormHandler;
import com.cljformatter.plugins.clojure.render.forms.DefMethodFormHandler;
import com.cljformatter.plugins.clojure.render.forms.DefnFormHandler;
import com.cljformatter.plugins.clojure.render.forms.NamespaceFormHandler;
import com.cljformatter.plugins.clojure.render.forms.PairBasedFormHandler;
import com.cljformatter.plugins.clojure.render.forms.TryFormHandler;
import com.cljformatter.plugins.clojure.tree.Atom;
import com.cljformatter.plugins.clojure.tree.NodeType;

import java.util.HashMap;
import java.util.Map;

/**
 * Lookup table from head symbol to the handler that lays the form out.
 * Registering a form is adding an entry.
 */
public final class SpecialForms {
    private static final String CORE_PREFIX = "clojure.core/";

    private final Map<String, FormHandler> handlers = new HashMap<>();

    /**
     * The table with every built-in layout rule.
     */
    public static SpecialForms standard() {
        SpecialForms forms = new SpecialForms();

        DefFormHandler def = new DefFormHandler();
        forms.register(def, "def", "defonce", "defmulti");

        forms.register(new DefnFormHandler(true), "defn", "defn-", "defmacro");
        forms.register(new DefnFormHandler(false), "fn", "fn*");
        forms.register(new DefMethodFormHandler(), "defmethod");

        forms.register(new BindingFormHandler(),
                "let", "let*", "loop", "loop*", "binding", "with-open", "with-redefs", "with-local-vars",
                "when-let", "when-some", "when-first", "if-let", "if-some", "dotimes", "doseq", "for");

        forms.register(new ConditionalFormHandler(1),
                "if", "if-not", "when", "when-not", "while", "doto", "locking", "letfn",
                "defprotocol", "extend-protocol", "extend-type", "reify");
        forms.register(new ConditionalFormHandler(2), "defrecord", "deftype");

        forms.register(new PairBasedFormHandler(0), "cond");
        forms.register(new PairBasedFormHandler(1), "case", "cond->", "cond->>");
        forms.register(new PairBasedFormHandler(2), "condp");

        forms.register(new TryFormHandler(), "try");

        forms.register(new BodyFormHandler(),
                "do", "comment", "future", "delay", "lazy-seq", "dosync", "with-out-str", "time", "io!");

        forms.register(new NamespaceFormHandler(), "ns");
        return forms;
    }

    public void register(FormHandler handler, String... symbols) {
        for (String symbol : symbols) {
            handlers.put(symbol, handler);
        }
    }

    /**
     * Handler for a head symbol; symbols qualified with {@code clojure.core/} resolve like bare ones.
     */
    public FormHandler lookup(String symbol) {
        FormHandler handler = handlers.get(symbol);
        if (handler == null && symbol.startsWith(CORE_PREFIX)) {
            handler = handlers.get(symbol.substring(CORE_PREFIX.length()));
        }
        return handler;
    }

    /**
     * Handler for the head item of a list, or {@code null} for a plain call.
     */
    public FormHandler lookup(Item head) {
        if (head.hasPrefix() || head.getElement().getType() != NodeType.ATOM) {
            return null;
        }
        return lookup(((Atom) head.getElement()).getText());
    }

    public boolean managesOwnComments(Item head) {
        FormHandler handler = lookup(head);
        return handler != null && handler.managesOwnComments();
    }
}
