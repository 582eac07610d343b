package com.qrl.review.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free text into the ordered keyword list used by the keyword finder.
 * Splits on anything that is not a Unicode letter or digit so accented
 * letters (č, ć, ž, š, đ) stay inside their tokens.
 */
public class KeywordExtractor {
    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final StopWordList stopWords;
    private final int minTokenLength;
    private final int maxTokens;

    public KeywordExtractor(StopWordList stopWords, int minTokenLength, int maxTokens) {
        this.stopWords = stopWords;
        this.minTokenLength = Math.max(1, minTokenLength);
        this.maxTokens = Math.max(1, maxTokens);
    }

    public List<String> extract(String rawText) {
        String normalized = TextNormalizer.normalize(rawText).toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATOR.split(normalized)) {
            if (token.length() < minTokenLength || stopWords.contains(token)) {
                continue;
            }
            tokens.add(token);
            if (tokens.size() >= maxTokens) {
                break;
            }
        }
        return List.copyOf(tokens);
    }
}
