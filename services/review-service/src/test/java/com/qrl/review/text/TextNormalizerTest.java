package com.qrl.review.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void replacesTagsWithSpacesAndCollapsesWhitespace() {
        assertThat(TextNormalizer.normalize("<p>Agent<br/>closed</p>\n\n  the   ticket "))
            .isEqualTo("Agent closed the ticket");
    }

    @Test
    void nullAndEmptyBecomeEmptyString() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("")).isEmpty();
        assertThat(TextNormalizer.normalize("<div>  </div>")).isEmpty();
    }

    @Test
    void doesNotTruncateLongText() {
        String longText = "a".repeat(20000);
        assertThat(TextNormalizer.normalize(longText)).hasSize(20000);
    }
}
