package com.prepair.backend.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable word tables shared by the analyzers.
 *
 * Built once at startup (see {@code LexiconConfig}) and passed by reference,
 * never re-created per request.
 */
public final class Lexicon {

    private final Set<String> stopWords;

    private Lexicon(Set<String> stopWords) {
        this.stopWords = Set.copyOf(stopWords);
    }

    public static Lexicon of(Collection<String> stopWords) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String word : stopWords) {
            if (word != null && !word.isBlank()) {
                normalized.add(word.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new Lexicon(normalized);
    }

    /**
     * Reads one stop word per line; blank lines and lines starting with
     * {@code #} are skipped.
     */
    public static Lexicon load(InputStream in) {
        Set<String> words = new LinkedHashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    words.add(trimmed);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stop word list", e);
        }
        return of(words);
    }

    public boolean isStopWord(String token) {
        return stopWords.contains(token);
    }

    public int size() {
        return stopWords.size();
    }
}
