package app.taxguide.ask.provider.paystack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;
import java.util.function.Supplier;

@Component
public class PaystackClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final PaystackProps props;

    public PaystackClient(RestClient.Builder restClientBuilder,
                          PaystackProps props,
                          ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(positiveOr(props.connectTimeoutMs(), 5_000));
        requestFactory.setReadTimeout(positiveOr(props.readTimeoutMs(), 15_000));
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public PaystackCheckout initialize(String email, long amountKobo, Map<String, String> metadata) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("email", email);
        payload.put("amount", amountKobo);
        payload.put("currency", currency());
        if (props.callbackUrl() != null && !props.callbackUrl().isBlank()) {
            payload.put("callback_url", props.callbackUrl());
        }
        ObjectNode meta = payload.putObject("metadata");
        metadata.forEach(meta::put);

        JsonNode data = call(() -> restClient.post()
                .uri("/transaction/initialize")
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class));
        String reference = data.path("reference").asText(null);
        if (reference == null || reference.isBlank()) {
            throw new PaymentProviderException("Paystack initialize returned no reference");
        }
        return new PaystackCheckout(reference, data.path("authorization_url").asText(null),
                data.path("access_code").asText(null));
    }

    public PaystackTransaction verify(String reference) {
        JsonNode data = call(() -> restClient.get()
                .uri("/transaction/verify/{reference}", reference)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(JsonNode.class));
        JsonNode metadata = metadataOf(data.path("metadata"));
        return new PaystackTransaction(
                data.path("reference").asText(reference),
                data.path("status").asText(""),
                data.path("amount").asLong(0),
                data.path("currency").asText(null),
                textOrNull(metadata, "account_id"),
                textOrNull(metadata, "plan_code"),
                textOrNull(metadata, "upgrade_mode")
        );
    }

    public String currency() {
        return props.currency() == null || props.currency().isBlank() ? "NGN" : props.currency();
    }

    /**
     * Unwraps the {@code data} node of a {@code {status, message, data}} envelope.
     */
    private JsonNode call(Supplier<JsonNode> request) {
        if (props.secretKey() == null || props.secretKey().isBlank()) {
            throw new PaymentProviderException("Paystack secret key is not configured");
        }
        JsonNode response;
        try {
            response = request.get();
        } catch (RestClientException ex) {
            throw new PaymentProviderException("Paystack request failed: " + ex.getClass().getSimpleName(), ex);
        }
        if (response == null || !response.path("status").asBoolean(false)) {
            String message = response == null ? "empty response" : response.path("message").asText("status=false");
            throw new PaymentProviderException("Paystack rejected request: " + message);
        }
        return response.path("data");
    }

    // metadata arrives as an object, or as a JSON string when set through the dashboard
    private JsonNode metadataOf(JsonNode node) {
        if (node.isTextual()) {
            try {
                return objectMapper.readTree(node.asText());
            } catch (JsonProcessingException ex) {
                return objectMapper.createObjectNode();
            }
        }
        return node;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private String bearer() {
        return "Bearer " + props.secretKey();
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
