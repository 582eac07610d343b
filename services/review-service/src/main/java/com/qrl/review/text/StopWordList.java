package com.qrl.review.text;

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
import org.springframework.core.io.Resource;

/**
 * Immutable set of lower-cased stop words. One word per line in the source
 * resource; blank lines and lines starting with {@code #} are ignored.
 */
public final class StopWordList {
    private final Set<String> words;

    private StopWordList(Set<String> words) {
        this.words = Set.copyOf(words);
    }

    public static StopWordList of(Collection<String> words) {
        Set<String> normalized = new LinkedHashSet<>();
        if (words != null) {
            for (String word : words) {
                addWord(normalized, word);
            }
        }
        return new StopWordList(normalized);
    }

    public static StopWordList load(Resource resource, Collection<String> extraWords) {
        Set<String> normalized = new LinkedHashSet<>();
        try (InputStream in = resource.getInputStream();
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("#")) {
                    continue;
                }
                addWord(normalized, line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load stop words from " + resource.getDescription(), e);
        }
        if (extraWords != null) {
            for (String word : extraWords) {
                addWord(normalized, word);
            }
        }
        return new StopWordList(normalized);
    }

    private static void addWord(Set<String> target, String word) {
        if (word == null) {
            return;
        }
        String value = word.trim().toLowerCase(Locale.ROOT);
        if (!value.isEmpty()) {
            target.add(value);
        }
    }

    public boolean contains(String token) {
        return token != null && words.contains(token);
    }

    public int size() {
        return words.size();
    }
}
