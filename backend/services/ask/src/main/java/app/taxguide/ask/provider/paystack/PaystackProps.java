package app.taxguide.ask.provider.paystack;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.billing.paystack")
public record PaystackProps(
        String baseUrl,
        String secretKey,
        String callbackUrl,
        String currency,
        Integer connectTimeoutMs,
        Integer readTimeoutMs
) {
}
