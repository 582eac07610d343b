package com.qrl.review.summary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.SocketTimeoutException;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/** Client for an OpenAI-compatible {@code POST /v1/chat/completions} endpoint. */
@Component
public class SummaryGateway {
    private final RestTemplate restTemplate;
    private final SummaryProperties properties;

    public SummaryGateway(
        @Qualifier("summaryRestTemplate") RestTemplate restTemplate,
        SummaryProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public String complete(String prompt) {
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new SummaryUnavailableException("summary_base_url_missing");
        }
        ChatRequest request = new ChatRequest();
        request.setModel(properties.getModel());
        request.setMessages(List.of(new ChatMessage("user", prompt)));
        request.setMaxCompletionTokens(properties.getMaxCompletionTokens());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }

        try {
            ResponseEntity<ChatResponse> response = restTemplate.exchange(
                buildUrl("/v1/chat/completions"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                ChatResponse.class
            );
            ChatResponse body = response.getBody();
            if (body == null || body.getChoices() == null || body.getChoices().isEmpty()) {
                throw new SummaryUnavailableException("summary_empty_response");
            }
            ChatMessage message = body.getChoices().get(0).getMessage();
            return message == null || message.getContent() == null ? "" : message.getContent().trim();
        } catch (ResourceAccessException e) {
            String reason = e.getCause() instanceof SocketTimeoutException ? "summary_timeout" : "summary_unavailable";
            throw new SummaryUnavailableException(reason, e);
        } catch (HttpStatusCodeException e) {
            throw new SummaryUnavailableException("summary_http_" + e.getStatusCode().value(), e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatRequest {
        private String model;
        private List<ChatMessage> messages;

        @JsonProperty("max_completion_tokens")
        private Integer maxCompletionTokens;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<ChatMessage> getMessages() {
            return messages;
        }

        public void setMessages(List<ChatMessage> messages) {
            this.messages = messages;
        }

        public Integer getMaxCompletionTokens() {
            return maxCompletionTokens;
        }

        public void setMaxCompletionTokens(Integer maxCompletionTokens) {
            this.maxCompletionTokens = maxCompletionTokens;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatMessage {
        private String role;
        private String content;

        public ChatMessage() {
        }

        public ChatMessage(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatResponse {
        private List<Choice> choices;

        public List<Choice> getChoices() {
            return choices;
        }

        public void setChoices(List<Choice> choices) {
            this.choices = choices;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private int index;
        private ChatMessage message;

        public int getIndex() {
            return index;
        }

        public void setIndex(int index) {
            this.index = index;
        }

        public ChatMessage getMessage() {
            return message;
        }

        public void setMessage(ChatMessage message) {
            this.message = message;
        }
    }
}
