package com.deckinverter.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Warning collector scoped to one document. Passed down from the document
 * worker through the shape and image layers, then copied into that
 * document's result. Not thread-safe; a document is processed by one thread.
 */
public class Diagnostics {

    private final List<String> warnings = new ArrayList<>();
    private String prefix = "";

    public void warn(String message) {
        warnings.add(prefix + message);
    }

    public void warn(String format, Object... args) {
        warn(String.format(Locale.ROOT, format, args));
    }

    /** Prefix every following warning, e.g. with the current slide number. */
    public void setPrefix(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    public int size() {
        return warnings.size();
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<String> since(int mark) {
        return List.copyOf(warnings.subList(mark, warnings.size()));
    }
}
