package com.qrl.review.text;

import com.qrl.review.model.ConversationContent;
import com.qrl.review.model.ReviewContent;
import com.qrl.review.model.TicketContent;
import java.util.Locale;

public class ReviewTextExtractor {
    private final int minEmbeddableLength;

    public ReviewTextExtractor(int minEmbeddableLength) {
        this.minEmbeddableLength = Math.max(1, minEmbeddableLength);
    }

    public ExtractedText extract(ReviewContent content) {
        if (content == null) {
            return new ExtractedText("", "");
        }
        String notes = TextNormalizer.normalize(content.notes());
        String feedback = TextNormalizer.normalize(content.feedback());

        if (content instanceof TicketContent) {
            return new ExtractedText(lower(notes), combine(notes, feedback, null));
        }
        if (content instanceof ConversationContent conversation) {
            String excerpt = TextNormalizer.normalize(conversation.conversationExcerpt());
            String keywordText = excerpt.isEmpty() ? notes : (notes + " " + excerpt).trim();
            return new ExtractedText(lower(keywordText), combine(notes, feedback, excerpt));
        }
        throw new IllegalStateException("unsupported review content: " + content.getClass().getName());
    }

    public int getMinEmbeddableLength() {
        return minEmbeddableLength;
    }

    private String combine(String notes, String feedback, String excerpt) {
        if (notes.length() < minEmbeddableLength) {
            return "";
        }
        StringBuilder builder = new StringBuilder(notes);
        if (!feedback.isEmpty()) {
            builder.append(" | ").append(feedback);
        }
        if (excerpt != null && !excerpt.isEmpty()) {
            builder.append(" | Conversation: ").append(excerpt);
        }
        return builder.toString();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
