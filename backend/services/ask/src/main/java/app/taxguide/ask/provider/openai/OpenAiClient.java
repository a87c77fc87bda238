package app.taxguide.ask.provider.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class OpenAiClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public OpenAiClient(RestClient.Builder restClientBuilder,
                        OpenAiProps props,
                        ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(positiveOr(props.connectTimeoutMs(), 5_000));
        requestFactory.setReadTimeout(positiveOr(props.readTimeoutMs(), 30_000));
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
        this.apiKey = props.apiKey();
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public OpenAiResponseResult createResponse(OpenAiResponseRequest request) {
        if (!isConfigured()) {
            throw new IllegalStateException("OpenAI api key is not configured");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", request.model());
        ArrayNode input = payload.putArray("input");
        if (request.instructions() != null && !request.instructions().isBlank()) {
            input.addObject().put("role", "system").put("content", request.instructions());
        }
        input.addObject().put("role", "user").put("content", request.input());
        if (request.maxOutputTokens() != null && request.maxOutputTokens() > 0) {
            payload.put("max_output_tokens", request.maxOutputTokens());
        }
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }

        JsonNode response = restClient.post()
                .uri("/v1/responses")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("OpenAI response is empty");
        }

        String outputText = OpenAiResponseParser.extractText(response);
        String model = response.path("model").asText(null);
        JsonNode usage = response.path("usage");
        Integer inputTokens = usage.hasNonNull("input_tokens") ? usage.get("input_tokens").asInt() : null;
        Integer outputTokens = usage.hasNonNull("output_tokens") ? usage.get("output_tokens").asInt() : null;
        return new OpenAiResponseResult(outputText, model, inputTokens, outputTokens);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
