package ai.dualpdf.translator.language;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Labeler that posts directly to {@code {base}/chat/completions} of an OpenAI-compatible endpoint.
 */
public class HttpLanguageLabeler implements LanguageLabeler {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LabelerSettings settings;

    public HttpLanguageLabeler(LabelerSettings settings) {
        this(HttpClient.newBuilder().connectTimeout(settings.timeout()).build(), new ObjectMapper(), settings);
    }

    HttpLanguageLabeler(HttpClient httpClient, ObjectMapper objectMapper, LabelerSettings settings) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String label(String base64Jpeg) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint())
                    .timeout(settings.timeout())
                    .header("Authorization", "Bearer " + settings.apiKey())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload(base64Jpeg))))
                    .build();
        } catch (IOException ex) {
            throw new LanguageDetectionException("Failed to encode labeling request", ex);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new LanguageDetectionException("Labeling request failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LanguageDetectionException("Labeling request interrupted", ex);
        }
        if (response.statusCode() / 100 != 2) {
            throw new LanguageDetectionException("Labeling endpoint returned HTTP " + response.statusCode());
        }
        return extractContent(response.body());
    }

    ObjectNode payload(String base64Jpeg) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", settings.model());
        root.put("temperature", settings.temperature());
        root.put("max_tokens", settings.maxTokens());
        ArrayNode messages = root.putArray("messages");

        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", LabelerSettings.SYSTEM_PROMPT);

        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        ObjectNode image = content.addObject();
        image.put("type", "image_url");
        ObjectNode imageUrl = image.putObject("image_url");
        imageUrl.put("url", "data:image/jpeg;base64," + base64Jpeg);
        imageUrl.put("detail", settings.detail().wireValue());
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", LabelerSettings.USER_PROMPT);
        return root;
    }

    String extractContent(String body) {
        try {
            JsonNode message = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
            return message.isTextual() ? message.asText().strip() : "";
        } catch (IOException ex) {
            throw new LanguageDetectionException("Labeling endpoint returned malformed JSON", ex);
        }
    }

    private URI endpoint() {
        String base = settings.baseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/chat/completions");
    }
}
