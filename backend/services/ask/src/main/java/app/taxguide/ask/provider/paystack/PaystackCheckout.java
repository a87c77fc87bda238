package app.taxguide.ask.provider.paystack;

public record PaystackCheckout(
        String reference,
        String authorizationUrl,
        String accessCode
) {
}
