package com.qrl.review.embed;

import com.qrl.review.cache.TextDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Hashed bag-of-words embedder. Texts sharing words land close together,
 * which is enough to exercise the vector path without a provider.
 */
@Component
public class ToyEmbedder {
    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimensions;

    @Autowired
    public ToyEmbedder(EmbeddingProperties properties) {
        this(properties.getDimensions());
    }

    public ToyEmbedder(int dimensions) {
        this.dimensions = Math.max(8, dimensions);
    }

    public List<Double> embed(String text) {
        double[] values = new double[dimensions];
        for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            long hash = TextDigest.leadingLong(token);
            int bucket = (int) Math.floorMod(hash, (long) dimensions);
            values[bucket] += (hash & 1L) == 0 ? 1.0 : -1.0;
        }
        double sumSquares = 0.0;
        for (double value : values) {
            sumSquares += value * value;
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(dimensions);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    public int getDimensions() {
        return dimensions;
    }
}
