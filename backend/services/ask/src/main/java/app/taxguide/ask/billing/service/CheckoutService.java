package app.taxguide.ask.billing.service;

import app.taxguide.ask.billing.domain.type.UpgradeMode;
import app.taxguide.ask.config.PlanCatalog;
import app.taxguide.ask.config.PlanCatalog.PlanSpec;
import app.taxguide.ask.provider.paystack.PaystackCheckout;
import app.taxguide.ask.provider.paystack.PaystackClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final PaystackClient paystackClient;
    private final PaymentMarkerService markerService;
    private final PlanCatalog planCatalog;

    public CheckoutService(PaystackClient paystackClient, PaymentMarkerService markerService, PlanCatalog planCatalog) {
        this.paystackClient = paystackClient;
        this.markerService = markerService;
        this.planCatalog = planCatalog;
    }

    /**
     * Opens a Paystack checkout and records a pending marker holding the expected amount.
     */
    public CheckoutResponse checkout(UUID accountId, String planCode, String email, String upgradeMode) {
        PlanSpec plan = planCatalog.find(planCode)
                .filter(PlanSpec::isPaid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown plan: " + planCode));
        UpgradeMode mode = UpgradeMode.parse(upgradeMode);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("account_id", accountId.toString());
        metadata.put("plan_code", plan.code());
        metadata.put("upgrade_mode", mode.name());
        PaystackCheckout checkout = paystackClient.initialize(email, plan.priceKobo(), metadata);

        markerService.recordPending(checkout.reference(), accountId, plan.code(), mode, plan.priceKobo(),
                paystackClient.currency());
        log.info("Checkout opened reference={} accountId={} plan={} upgradeMode={}",
                checkout.reference(), accountId, plan.code(), mode);
        return new CheckoutResponse(checkout.reference(), checkout.authorizationUrl(), checkout.accessCode(),
                plan.code(), plan.priceKobo(), paystackClient.currency(), mode);
    }

    public record CheckoutResponse(
            String reference,
            String authorizationUrl,
            String accessCode,
            String planCode,
            long amountKobo,
            String currency,
            UpgradeMode upgradeMode
    ) {
    }
}
