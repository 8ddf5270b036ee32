package com.cljformatter.plugins;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FileTypeTest {

    @TempDir
    Path dir;

    @ParameterizedTest
    @CsvSource({
            "core.clj, CLOJURE",
            "app.cljs, CLOJURESCRIPT",
            "shared.cljc, CLOJURE_COMMON",
            "deps.edn, EDN",
            "UPPER.CLJ, CLOJURE",
            "Main.java, UNKNOWN",
            "README, UNKNOWN",
    })
    void detectsByExtension(String fileName, FileType expected) {
        assertEquals(expected, FileType.detect(dir.resolve(fileName)));
    }

    @Test
    void extensionMayCarryItsDot() {
        assertEquals(FileType.EDN, FileType.fromExtension(".edn"));
        assertEquals(FileType.UNKNOWN, FileType.fromExtension(""));
    }

    @Test
    void extensionlessScriptsAreDetectedByShebang() throws IOException {
        Path bb = Files.writeString(dir.resolve("task"), "#!/usr/bin/env bb\n(println 1)\n");
        Path clojure = Files.writeString(dir.resolve("run"), "#!/usr/bin/env clojure\n(println 1)\n");
        Path shell = Files.writeString(dir.resolve("build"), "#!/bin/sh\necho 1\n");
        assertEquals(FileType.CLOJURE, FileType.detect(bb));
        assertEquals(FileType.CLOJURE, FileType.detect(clojure));
        assertEquals(FileType.UNKNOWN, FileType.detect(shell));
    }
}
