package com.qrl.review.text;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class KeywordExtractorTest {
    private KeywordExtractor extractor;

    @BeforeEach
    void setUp() {
        StopWordList stopWords = StopWordList.load(new ClassPathResource("text/stopwords.txt"), List.of());
        extractor = new KeywordExtractor(stopWords, 3, 15);
    }

    @Test
    void dropsShortTokensAndBilingualStopWords() {
        assertThat(extractor.extract("close-ovao tiket nakon rg1 macro-a"))
            .containsExactly("close", "ovao", "tiket", "rg1", "macro");
        assertThat(extractor.extract("The agent was lepo dobro helpful"))
            .containsExactly("agent", "helpful");
    }

    @Test
    void keepsAccentedLettersInsideTokens() {
        assertThat(extractor.extract("Agent nije proverio račun, žalba odbijena"))
            .containsExactly("agent", "nije", "proverio", "račun", "žalba", "odbijena");
    }

    @Test
    void stripsMarkupBeforeTokenizing() {
        assertThat(extractor.extract("<b>Refund</b><i>delayed</i>")).containsExactly("refund", "delayed");
    }

    @Test
    void keepsOnlyFirstFifteenTokensInOrder() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            text.append("word").append(i).append(' ');
        }
        List<String> tokens = extractor.extract(text.toString());
        assertThat(tokens).hasSize(15);
        assertThat(tokens.get(0)).isEqualTo("word0");
        assertThat(tokens.get(14)).isEqualTo("word14");
    }

    @Test
    void emptyInputYieldsNoTokens() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("an of to")).isEmpty();
    }
}
