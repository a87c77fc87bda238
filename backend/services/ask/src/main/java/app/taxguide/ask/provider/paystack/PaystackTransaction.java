package app.taxguide.ask.provider.paystack;

/**
 * Authoritative transaction as reported by the verify endpoint. Metadata fields may be null.
 */
public record PaystackTransaction(
        String reference,
        String status,
        long amountKobo,
        String currency,
        String accountId,
        String planCode,
        String upgradeMode
) {

    public boolean isSuccessful() {
        return "success".equalsIgnoreCase(status);
    }
}
