package app.taxguide.ask.billing.service;

import app.taxguide.ask.billing.domain.entity.PaymentEntity;
import app.taxguide.ask.billing.domain.type.PaymentStatus;
import app.taxguide.ask.billing.domain.type.UpgradeMode;
import app.taxguide.ask.billing.repository.PaymentRepository;
import app.taxguide.ask.config.PlanCatalog;
import app.taxguide.ask.config.PlanCatalog.PlanSpec;
import app.taxguide.ask.provider.paystack.PaymentProviderException;
import app.taxguide.ask.provider.paystack.PaystackClient;
import app.taxguide.ask.provider.paystack.PaystackTransaction;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.domain.type.AccessState;
import app.taxguide.ask.subscription.service.SubscriptionService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies Paystack payment notifications. The webhook body is only a trigger: the charge is
 * re-read from the verify endpoint and that record drives activation.
 */
@Service
public class PaymentFulfillmentService {

    static final String CHARGE_SUCCESS = "charge.success";

    private static final Logger log = LoggerFactory.getLogger(PaymentFulfillmentService.class);

    private final PaystackSignatureVerifier signatureVerifier;
    private final PaystackClient paystackClient;
    private final PaymentRepository paymentRepository;
    private final PaymentMarkerService markerService;
    private final SubscriptionService subscriptionService;
    private final PlanCatalog planCatalog;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public PaymentFulfillmentService(PaystackSignatureVerifier signatureVerifier,
                                     PaystackClient paystackClient,
                                     PaymentRepository paymentRepository,
                                     PaymentMarkerService markerService,
                                     SubscriptionService subscriptionService,
                                     PlanCatalog planCatalog,
                                     ObjectMapper objectMapper,
                                     PlatformTransactionManager transactionManager) {
        this.signatureVerifier = signatureVerifier;
        this.paystackClient = paystackClient;
        this.paymentRepository = paymentRepository;
        this.markerService = markerService;
        this.subscriptionService = subscriptionService;
        this.planCatalog = planCatalog;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public WebhookResult handleNotification(byte[] rawPayload, String signature) {
        if (!signatureVerifier.verify(rawPayload, signature)) {
            log.warn("Paystack webhook rejected reason=invalid_signature");
            return WebhookResult.invalidSignature();
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawPayload);
        } catch (IOException ex) {
            log.warn("Paystack webhook ignored reason=malformed_payload");
            return WebhookResult.ignored(null, "malformed_payload");
        }
        String event = payload.path("event").asText("");
        String reference = payload.path("data").path("reference").asText("").trim();
        if (!CHARGE_SUCCESS.equals(event)) {
            log.info("Paystack webhook ignored event={} reference={}", event, reference);
            return WebhookResult.ignored(reference.isEmpty() ? null : reference, "event_ignored");
        }
        if (reference.isEmpty()) {
            return WebhookResult.ignored(null, "missing_reference");
        }

        Optional<PaymentEntity> marker = paymentRepository.findById(reference);
        if (marker.isPresent() && marker.get().getStatus() == PaymentStatus.success) {
            log.info("Paystack webhook replay reference={}", reference);
            return WebhookResult.replay(reference, statusOf(marker.get().getAccountId()));
        }

        PaystackTransaction transaction;
        try {
            transaction = paystackClient.verify(reference);
        } catch (PaymentProviderException ex) {
            log.warn("Paystack verification unavailable reference={} error={}", reference, ex.getMessage());
            return WebhookResult.retryLater(reference, "verification_unavailable");
        }
        return fulfill(reference, transaction, marker.orElse(null));
    }

    private WebhookResult fulfill(String reference, PaystackTransaction transaction, PaymentEntity pending) {
        String accountRaw = transaction.accountId() != null ? transaction.accountId()
                : pending == null || pending.getAccountId() == null ? null : pending.getAccountId().toString();
        String planRaw = transaction.planCode() != null ? transaction.planCode()
                : pending == null ? null : pending.getPlanCode();
        UUID accountId = parseAccount(accountRaw);
        String planCode = PlanCatalog.normalize(planRaw);

        if (!transaction.isSuccessful()) {
            return reject(reference, accountId, planCode, "charge_not_successful");
        }
        if (accountRaw == null) {
            return reject(reference, null, planCode, "missing_account_id");
        }
        if (accountId == null) {
            return reject(reference, null, planCode, "invalid_account_id");
        }
        if (planCode == null) {
            return reject(reference, accountId, null, "missing_plan_code");
        }
        PlanSpec plan = planCatalog.find(planCode).filter(PlanSpec::isPaid).orElse(null);
        if (plan == null) {
            return reject(reference, accountId, planCode, "unknown_plan");
        }
        String mismatch = amountMismatch(transaction, plan, pending);
        if (mismatch != null) {
            return reject(reference, accountId, planCode, mismatch);
        }

        UpgradeMode upgradeMode = UpgradeMode.parse(transaction.upgradeMode() != null
                ? transaction.upgradeMode()
                : pending == null ? null : pending.getUpgradeMode());
        Optional<WebhookResult> applied = transactionTemplate.execute(status -> {
            Optional<WebhookResult> outcome = applyPayment(reference, accountId, plan, upgradeMode, transaction);
            if (outcome.isEmpty()) {
                status.setRollbackOnly();
            }
            return outcome;
        });
        if (applied == null || applied.isEmpty()) {
            return reject(reference, accountId, plan.code(), "pending_change_exists");
        }
        WebhookResult result = applied.get();
        log.info("Paystack payment processed reference={} accountId={} plan={} activated={} idempotent={}",
                reference, accountId, plan.code(), result.activated(), result.idempotent());
        return result;
    }

    /**
     * Runs in one transaction: the marker flips to success and the subscription changes
     * together, or neither does. Empty when an at-expiry payment meets an already pending
     * change; the caller rolls back so the payment is recorded as failed instead.
     */
    private Optional<WebhookResult> applyPayment(String reference, UUID accountId, PlanSpec plan,
                                                 UpgradeMode upgradeMode, PaystackTransaction transaction) {
        boolean claimed = markerService.claimSuccess(reference, accountId, plan.code(), upgradeMode,
                transaction.amountKobo(), normalizeCurrency(transaction.currency()));
        if (!claimed) {
            return Optional.of(WebhookResult.replay(reference, subscriptionService.status(accountId)));
        }
        if (upgradeMode == UpgradeMode.at_expiry) {
            SubscriptionView current = subscriptionService.status(accountId);
            if (current.state() == AccessState.active || current.state() == AccessState.trial) {
                return subscriptionService.trySchedule(accountId, plan.code())
                        .map(view -> WebhookResult.applied(reference, true, view));
            }
        }
        return Optional.of(WebhookResult.applied(reference, false,
                subscriptionService.activate(accountId, plan.code(), null)));
    }

    private String amountMismatch(PaystackTransaction transaction, PlanSpec plan, PaymentEntity pending) {
        String currency = normalizeCurrency(transaction.currency());
        long expectedAmount = pending != null && pending.getAmountKobo() != null
                ? pending.getAmountKobo()
                : plan.priceKobo();
        String expectedCurrency = pending != null && pending.getCurrency() != null
                ? normalizeCurrency(pending.getCurrency())
                : normalizeCurrency(paystackClient.currency());
        if (transaction.amountKobo() != expectedAmount) {
            return "amount_mismatch";
        }
        if (!expectedCurrency.equals(currency)) {
            return "currency_mismatch";
        }
        return null;
    }

    private WebhookResult reject(String reference, UUID accountId, String planCode, String reason) {
        log.warn("Paystack payment not applied reference={} accountId={} plan={} reason={}",
                reference, accountId, planCode, reason);
        markerService.recordFailure(reference, accountId, planCode, reason);
        return WebhookResult.rejected(reference, reason);
    }

    private SubscriptionView statusOf(UUID accountId) {
        return accountId == null ? null : subscriptionService.status(accountId);
    }

    private static UUID parseAccount(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static String normalizeCurrency(String currency) {
        return currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
    }
}
