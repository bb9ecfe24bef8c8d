package com.phillippitts.genesis.service.reasoning;

import com.phillippitts.genesis.config.properties.ReasoningProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Calls the Gemini {@code generateContent} REST endpoint.
 *
 * <p>Every request carries the configured generation settings and blocks harassment, hate
 * speech, sexually explicit and dangerous content at medium probability and above.
 */
public class GeminiRestClient implements GenerativeModelClient {

    private static final Logger LOG = LogManager.getLogger(GeminiRestClient.class);

    static final String API_KEY_HEADER = "x-goog-api-key";
    static final String SAFETY_THRESHOLD = "BLOCK_MEDIUM_AND_ABOVE";
    static final List<String> SAFETY_CATEGORIES = List.of(
            "HARM_CATEGORY_HARASSMENT",
            "HARM_CATEGORY_HATE_SPEECH",
            "HARM_CATEGORY_SEXUALLY_EXPLICIT",
            "HARM_CATEGORY_DANGEROUS_CONTENT"
    );

    private final RestClient restClient;
    private final ReasoningProperties props;

    /**
     * @param builder builder with transport settings (timeouts, request factory) already applied
     * @param props model, endpoint and generation settings
     */
    public GeminiRestClient(RestClient.Builder builder, ReasoningProperties props) {
        this.props = props;
        this.restClient = builder
                .baseUrl(props.getBaseUrl())
                .defaultHeader(API_KEY_HEADER, props.getApiKey())
                .build();
        LOG.info("Gemini client configured with model '{}'", props.getModel());
    }

    @Override
    public String generate(String prompt) {
        String response = restClient.post()
                .uri("/models/{model}:generateContent", props.getModel())
                .contentType(MediaType.APPLICATION_JSON)
                .body(requestBody(prompt).toString())
                .retrieve()
                .body(String.class);
        return response == null ? null : extractText(response);
    }

    JSONObject requestBody(String prompt) {
        JSONObject part = new JSONObject().put("text", prompt);
        JSONObject content = new JSONObject()
                .put("role", "user")
                .put("parts", new JSONArray().put(part));

        JSONObject generationConfig = new JSONObject()
                .put("temperature", props.getTemperature())
                .put("maxOutputTokens", props.getMaxOutputTokens());

        JSONArray safetySettings = new JSONArray();
        for (String category : SAFETY_CATEGORIES) {
            safetySettings.put(new JSONObject()
                    .put("category", category)
                    .put("threshold", SAFETY_THRESHOLD));
        }

        return new JSONObject()
                .put("contents", new JSONArray().put(content))
                .put("generationConfig", generationConfig)
                .put("safetySettings", safetySettings);
    }

    /**
     * Concatenates the text parts of the first candidate.
     *
     * @return trimmed text, or {@code null} if there is no candidate or it carries no text
     */
    static String extractText(String responseJson) {
        JSONObject root = new JSONObject(responseJson);
        JSONArray candidates = root.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            JSONObject feedback = root.optJSONObject("promptFeedback");
            String blockReason = feedback == null ? "none" : feedback.optString("blockReason", "none");
            LOG.warn("Gemini returned no candidates (blockReason={})", blockReason);
            return null;
        }
        JSONObject candidate = candidates.getJSONObject(0);
        JSONObject content = candidate.optJSONObject("content");
        JSONArray parts = content == null ? null : content.optJSONArray("parts");
        if (parts == null) {
            LOG.warn("Gemini candidate has no content (finishReason={})", candidate.optString("finishReason", "unknown"));
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < parts.length(); i++) {
            JSONObject part = parts.optJSONObject(i);
            if (part != null) {
                text.append(part.optString("text", ""));
            }
        }
        String result = text.toString().trim();
        return result.isEmpty() ? null : result;
    }
}
