package app.taxguide.ask.billing.service;

import app.taxguide.ask.billing.domain.entity.PaymentEntity;
import app.taxguide.ask.billing.domain.type.PaymentStatus;
import app.taxguide.ask.billing.domain.type.UpgradeMode;
import app.taxguide.ask.billing.repository.PaymentRepository;
import app.taxguide.ask.config.AskProps;
import app.taxguide.ask.config.PlanCatalog;
import app.taxguide.ask.provider.paystack.PaymentProviderException;
import app.taxguide.ask.provider.paystack.PaystackClient;
import app.taxguide.ask.provider.paystack.PaystackProps;
import app.taxguide.ask.provider.paystack.PaystackTransaction;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.domain.type.AccessState;
import app.taxguide.ask.subscription.service.SubscriptionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentFulfillmentServiceTest {

    private static final String REFERENCE = "ref_123";

    @Mock
    PaystackClient paystackClient;

    @Mock
    PaymentRepository paymentRepository;

    @Mock
    PaymentMarkerService markerService;

    @Mock
    SubscriptionService subscriptionService;

    @Mock
    PlatformTransactionManager transactionManager;

    PaystackSignatureVerifier signatureVerifier;

    PaymentFulfillmentService service;

    private final UUID accountId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        AskProps props = new AskProps(
                "en",
                new AskProps.Subscription(5, "trial"),
                null,
                null,
                null,
                Map.of(
                        "trial", new AskProps.Plan(7, 5, 20, 0),
                        "monthly", new AskProps.Plan(30, 100, 1000, 330000)
                )
        );
        signatureVerifier = new PaystackSignatureVerifier(
                new PaystackProps("https://api.paystack.co", "sk_test_secret", null, "NGN", 1000, 1000));
        service = new PaymentFulfillmentService(signatureVerifier, paystackClient, paymentRepository, markerService,
                subscriptionService, new PlanCatalog(props), new ObjectMapper(), transactionManager);
    }

    @Test
    void invalidSignatureIsAcknowledgedAndIgnored() {
        byte[] body = chargeSuccess(REFERENCE);

        WebhookResult result = service.handleNotification(body, "deadbeef");

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).isEqualTo("invalid_signature");
        assertThat(result.acknowledged()).isTrue();
        verifyNoInteractions(paystackClient, markerService, subscriptionService);
    }

    @Test
    void otherEventsAreIgnored() {
        byte[] body = "{\"event\":\"transfer.success\",\"data\":{\"reference\":\"t_1\"}}"
                .getBytes(StandardCharsets.UTF_8);

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.ok()).isTrue();
        assertThat(result.reason()).isEqualTo("event_ignored");
        verifyNoInteractions(paystackClient);
    }

    @Test
    void successfulChargeActivatesPlan() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE)).thenReturn(transaction("success", 330000, "NGN", "monthly", null));
        when(paystackClient.currency()).thenReturn("NGN");
        when(markerService.claimSuccess(REFERENCE, accountId, "monthly", UpgradeMode.immediate, 330000, "NGN"))
                .thenReturn(true);
        SubscriptionView active = view(AccessState.active, "monthly");
        when(subscriptionService.activate(accountId, "monthly", null)).thenReturn(active);

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.ok()).isTrue();
        assertThat(result.activated()).isTrue();
        assertThat(result.idempotent()).isFalse();
        assertThat(result.subscription()).isEqualTo(active);
    }

    @Test
    void processedReferenceIsReplayWithoutVerification() {
        byte[] body = chargeSuccess(REFERENCE);
        PaymentEntity processed = mock(PaymentEntity.class);
        when(processed.getStatus()).thenReturn(PaymentStatus.success);
        when(processed.getAccountId()).thenReturn(accountId);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.of(processed));
        when(subscriptionService.status(accountId)).thenReturn(view(AccessState.active, "monthly"));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.ok()).isTrue();
        assertThat(result.idempotent()).isTrue();
        assertThat(result.activated()).isFalse();
        verifyNoInteractions(paystackClient);
        verify(subscriptionService, never()).activate(any(), any(), any());
    }

    @Test
    void lostClaimRaceIsReplay() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE)).thenReturn(transaction("success", 330000, "NGN", "monthly", null));
        when(paystackClient.currency()).thenReturn("NGN");
        when(markerService.claimSuccess(any(), any(), any(), any(), anyLong(), any())).thenReturn(false);
        when(subscriptionService.status(accountId)).thenReturn(view(AccessState.active, "monthly"));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.idempotent()).isTrue();
        verify(subscriptionService, never()).activate(any(), any(), any());
    }

    @Test
    void verificationOutageAsksForRetry() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE)).thenThrow(new PaymentProviderException("timeout"));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.acknowledged()).isFalse();
        assertThat(result.reason()).isEqualTo("verification_unavailable");
        verifyNoInteractions(markerService);
    }

    @Test
    void amountMismatchIsRejectedAndMarkedFailed() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE)).thenReturn(transaction("success", 100, "NGN", "monthly", null));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).isEqualTo("amount_mismatch");
        assertThat(result.acknowledged()).isTrue();
        verify(markerService).recordFailure(REFERENCE, accountId, "monthly", "amount_mismatch");
        verify(subscriptionService, never()).activate(any(), any(), any());
    }

    @Test
    void freePlanCannotBeBought() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE)).thenReturn(transaction("success", 0, "NGN", "trial", null));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.reason()).isEqualTo("unknown_plan");
    }

    @Test
    void failedChargeIsRejected() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE)).thenReturn(transaction("failed", 330000, "NGN", "monthly", null));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.reason()).isEqualTo("charge_not_successful");
        verify(markerService).recordFailure(REFERENCE, accountId, "monthly", "charge_not_successful");
    }

    @Test
    void atExpiryUpgradeSchedulesWhileCurrentPlanRuns() {
        byte[] body = chargeSuccess(REFERENCE);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE))
                .thenReturn(transaction("success", 330000, "NGN", "monthly", "at_expiry"));
        when(paystackClient.currency()).thenReturn("NGN");
        when(markerService.claimSuccess(REFERENCE, accountId, "monthly", UpgradeMode.at_expiry, 330000, "NGN"))
                .thenReturn(true);
        when(subscriptionService.status(accountId)).thenReturn(view(AccessState.trial, "trial"));
        SubscriptionView scheduled = view(AccessState.trial, "trial");
        when(subscriptionService.trySchedule(accountId, "monthly")).thenReturn(Optional.of(scheduled));

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.scheduled()).isTrue();
        assertThat(result.activated()).isFalse();
        verify(subscriptionService, never()).activate(any(), any(), any());
    }

    @Test
    void atExpiryUpgradeOverPendingChangeRollsBackAndIsMarkedFailed() {
        byte[] body = chargeSuccess(REFERENCE);
        SimpleTransactionStatus txStatus = new SimpleTransactionStatus();
        when(transactionManager.getTransaction(any())).thenReturn(txStatus);
        when(paymentRepository.findById(REFERENCE)).thenReturn(Optional.empty());
        when(paystackClient.verify(REFERENCE))
                .thenReturn(transaction("success", 330000, "NGN", "monthly", "at_expiry"));
        when(paystackClient.currency()).thenReturn("NGN");
        when(markerService.claimSuccess(REFERENCE, accountId, "monthly", UpgradeMode.at_expiry, 330000, "NGN"))
                .thenReturn(true);
        when(subscriptionService.status(accountId)).thenReturn(view(AccessState.active, "monthly"));
        when(subscriptionService.trySchedule(accountId, "monthly")).thenReturn(Optional.empty());

        WebhookResult result = service.handleNotification(body, signatureVerifier.sign(body));

        assertThat(result.ok()).isFalse();
        assertThat(result.acknowledged()).isTrue();
        assertThat(result.reason()).isEqualTo("pending_change_exists");
        assertThat(txStatus.isRollbackOnly()).isTrue();
        verify(markerService).recordFailure(REFERENCE, accountId, "monthly", "pending_change_exists");
        verify(subscriptionService, never()).activate(any(), any(), any());
    }

    private byte[] chargeSuccess(String reference) {
        return ("{\"event\":\"charge.success\",\"data\":{\"reference\":\"" + reference + "\",\"amount\":330000}}")
                .getBytes(StandardCharsets.UTF_8);
    }

    private PaystackTransaction transaction(String status, long amount, String currency, String plan, String mode) {
        return new PaystackTransaction(REFERENCE, status, amount, currency, accountId.toString(), plan, mode);
    }

    private SubscriptionView view(AccessState state, String planCode) {
        return new SubscriptionView(accountId, state.grantsAccess(), state, planCode,
                Instant.now().plusSeconds(86400), null, null, null, false);
    }
}
