package com.cljformatter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cljformatter.api.error.FormatterError;

/**
 * Outcome of formatting one file. An unsuccessful result carries the original text unchanged.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final boolean changed;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.changed = builder.changed;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    /**
     * A successful result; {@code changed} is derived by comparing the two texts.
     */
    public static FormatterResult formatted(String original, String formatted) {
        return builder()
                .successful(true)
                .formattedCode(formatted)
                .changed(!formatted.equals(original))
                .build();
    }

    /**
     * A failed result that keeps {@code original} as its text.
     */
    public static FormatterResult failed(String original, FormatterError error) {
        return builder()
                .successful(false)
                .formattedCode(original)
                .addError(error)
                .build();
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    /**
     * Whether the formatted code differs from the input, i.e. the input was not canonical.
     */
    public boolean isChanged() {
        return changed;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private boolean changed;
        private final List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder addError(FormatterError error) {
            errors.add(error);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
