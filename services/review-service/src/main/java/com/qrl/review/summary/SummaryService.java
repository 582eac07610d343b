package com.qrl.review.summary;

import com.qrl.review.model.ReviewRecord;
import com.qrl.review.resilience.CircuitBreaker;
import com.qrl.review.resilience.ReviewResilienceRegistry;
import com.qrl.review.text.TextNormalizer;
import java.util.Arrays;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class SummaryService implements SummaryProvider {
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s");

    private final SummaryProperties properties;
    private final SummaryGateway summaryGateway;
    private final ReviewResilienceRegistry resilienceRegistry;

    public SummaryService(
        SummaryProperties properties,
        SummaryGateway summaryGateway,
        ReviewResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.summaryGateway = summaryGateway;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public String summarize(ReviewRecord record) {
        if (properties.getMode() == SummaryMode.EXTRACTIVE) {
            return extractive(record);
        }
        CircuitBreaker breaker = resilienceRegistry.getSummaryBreaker();
        if (!breaker.allowRequest()) {
            throw new SummaryUnavailableException("summary_circuit_open");
        }
        try {
            String summary = summaryGateway.complete(buildPrompt(record));
            breaker.recordSuccess();
            return summary == null || summary.isBlank() ? FALLBACK_SUMMARY : summary;
        } catch (SummaryUnavailableException ex) {
            breaker.recordFailure();
            throw ex;
        }
    }

    String buildPrompt(ReviewRecord record) {
        String notes = orDefault(TextNormalizer.normalize(record.content().notes()), "No notes");
        String feedback = orDefault(TextNormalizer.normalize(record.content().feedback()), "No feedback");
        String categories = record.categories().isEmpty() ? "Unknown" : String.join(", ", record.categories());
        return "Based on the following QA ticket review, write ONE SHORT sentence (max "
            + properties.getMaxWords()
            + " words) summarizing what the agent did wrong. Be specific and actionable.\n\n"
            + "Categories: " + categories + "\n"
            + "Notes: " + notes + "\n"
            + "Feedback: " + feedback + "\n\n"
            + "Write ONLY the summary sentence, nothing else. Example format: "
            + "\"Failed to verify customer identity before processing refund request.\"";
    }

    private String extractive(ReviewRecord record) {
        String source = TextNormalizer.normalize(record.content().feedback());
        if (source.isEmpty()) {
            source = TextNormalizer.normalize(record.content().notes());
        }
        if (source.isEmpty()) {
            return FALLBACK_SUMMARY;
        }
        String sentence = SENTENCE_END.split(source, 2)[0];
        String[] words = sentence.split(" ");
        if (words.length <= properties.getMaxWords()) {
            return sentence;
        }
        return String.join(" ", Arrays.copyOf(words, properties.getMaxWords())) + "...";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
