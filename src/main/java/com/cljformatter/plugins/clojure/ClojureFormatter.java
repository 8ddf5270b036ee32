package com.cljformatter.plugins.clojure;

import java.nio.file.Path;
import java.util.logging.Logger;

import com.cljformatter.api.FormatterPlugin;
import com.cljformatter.api.FormatterResult;
import com.cljformatter.api.error.SyntaxError;
import com.cljformatter.config.ConfigurationLoader;
import com.cljformatter.config.FormatterConfig;
import com.cljformatter.util.LoggerUtil;

/**
 * Plugin for Clojure, ClojureScript, cljc and EDN files.
 */
public class ClojureFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(ClojureFormatter.class);

    private boolean finalNewline = true;

    @Override
    public void initialize(FormatterConfig config) {
        this.finalNewline = config.isFinalNewline();
        logger.fine("Clojure formatter initialized (finalNewline=" + finalNewline + ")");
    }

    @Override
    public String getName() {
        return ConfigurationLoader.CLOJURE_PLUGIN;
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        try {
            String formatted = ClojureSourceFormatter.formatSource(sourceCode);
            if (finalNewline && !formatted.isEmpty()) {
                formatted += "\n";
            }
            return FormatterResult.formatted(sourceCode, formatted);
        } catch (SyntaxError e) {
            logger.fine("Cannot read " + filePath + ": " + e.getMessage());
            return FormatterResult.failed(sourceCode, e.toFormatterError());
        }
    }
}
