package com.deckinverter.util;

import com.deckinverter.model.DocumentSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Renames documents whose output entries would collide, appending
 * {@code (2)}, {@code (3)}, ... to the later ones. Comparison is on the
 * output entry name, ignoring case.
 */
public final class NameDisambiguator {

    private NameDisambiguator() { /* utility class */ }

    public static List<DocumentSource> disambiguate(List<DocumentSource> documents, String suffix) {
        Set<String> usedNames = new HashSet<>();
        List<DocumentSource> unique = new ArrayList<>(documents.size());

        for (DocumentSource document : documents) {
            String name = document.getName();
            if (usedNames.add(key(name, suffix))) {
                unique.add(document);
                continue;
            }

            int counter = 2;
            while (!usedNames.add(key(numbered(name, counter), suffix))) {
                counter++;
            }
            unique.add(document.withName(numbered(name, counter)));
        }
        return unique;
    }

    static String numbered(String name, int counter) {
        int slash = name.lastIndexOf('/');
        String fileName = name.substring(slash + 1);
        String base = DeckArchives.stripExtension(fileName);
        String extension = fileName.substring(base.length());
        return name.substring(0, slash + 1) + base + " (" + counter + ")" + extension;
    }

    private static String key(String name, String suffix) {
        return DeckArchives.outputName(name, suffix).toLowerCase(Locale.ROOT);
    }
}
