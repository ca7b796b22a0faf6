package quest.gekko.insights.service.integration.summary;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.insights.config.InsightsProperties;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class GeminiSummaryProvider implements SummaryProvider {
    private final WebClient http;
    private final InsightsProperties.Summary summary;

    @Override
    public Optional<String> summarize(String prompt) {
        if (!summary.configured()) {
            log.debug("Gemini API key not configured, skipping summary");
            return Optional.empty();
        }

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "maxOutputTokens", summary.maxOutputTokens(),
                        "temperature", summary.temperature())
        );

        Map<?, ?> response = http.post()
                .uri(summary.baseUrl() + "/v1beta/models/{model}:generateContent?key={key}", summary.model(), summary.apiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(Map.class)
                .block(summary.timeout());

        return extractText(response).map(String::trim).filter(text -> !text.isEmpty());
    }

    static Optional<String> extractText(Map<?, ?> response) {
        if (response == null) return Optional.empty();
        if (!(response.get("candidates") instanceof List<?> candidates) || candidates.isEmpty()) return Optional.empty();
        if (!(candidates.get(0) instanceof Map<?, ?> candidate)) return Optional.empty();
        if (!(candidate.get("content") instanceof Map<?, ?> content)) return Optional.empty();
        if (!(content.get("parts") instanceof List<?> parts) || parts.isEmpty()) return Optional.empty();
        if (!(parts.get(0) instanceof Map<?, ?> part)) return Optional.empty();
        Object text = part.get("text");
        return text instanceof String s ? Optional.of(s) : Optional.empty();
    }
}
