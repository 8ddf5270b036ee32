package com.cljformatter.plugins;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cljformatter.util.LoggerUtil;

/**
 * Supported file types, detected by extension or, for extensionless scripts, by their shebang line.
 */
public enum FileType {
    CLOJURE("clj"),
    CLOJURESCRIPT("cljs"),
    CLOJURE_COMMON("cljc"),
    EDN("edn"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * The type for an extension without the dot, or {@link #UNKNOWN}.
     */
    public static FileType fromExtension(String extension) {
        String normalized = extension.toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (FileType type : values()) {
            if (type != UNKNOWN && type.extension.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public static FileType detect(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            return fromExtension(name.substring(dot + 1));
        }
        return _detectByShebang(filePath);
    }

    /**
     * Babashka and clojure scripts: {@code #!/usr/bin/env bb}, {@code #!/usr/bin/env clojure}.
     */
    private static FileType _detectByShebang(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            String firstLine = reader.readLine();
            if (firstLine != null && firstLine.startsWith("#!")
                    && (firstLine.endsWith(" bb") || firstLine.endsWith("/bb") || firstLine.contains("clojure"))) {
                return CLOJURE;
            }
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
        }
        return UNKNOWN;
    }

    public String getDescription() {
        return switch (this) {
            case CLOJURE -> "Clojure source file";
            case CLOJURESCRIPT -> "ClojureScript source file";
            case CLOJURE_COMMON -> "Clojure common (reader conditional) source file";
            case EDN -> "EDN data file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
