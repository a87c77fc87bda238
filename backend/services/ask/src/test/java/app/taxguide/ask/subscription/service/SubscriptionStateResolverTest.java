package app.taxguide.ask.subscription.service;

import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.domain.entity.SubscriptionEntity;
import app.taxguide.ask.subscription.domain.type.AccessState;
import app.taxguide.ask.subscription.domain.type.SubscriptionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionStateResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private final SubscriptionStateResolver resolver = new SubscriptionStateResolver(Duration.ofDays(5));

    @Test
    void noRecordMeansNoAccess() {
        assertThat(resolver.resolve(null, NOW)).isEqualTo(AccessState.none);

        SubscriptionView view = resolver.view(UUID.randomUUID(), null, NOW);
        assertThat(view.active()).isFalse();
        assertThat(view.state()).isEqualTo(AccessState.none);
    }

    @Test
    void activeBeforePeriodEnd() {
        SubscriptionEntity record = record(SubscriptionStatus.active, NOW.plus(Duration.ofDays(10)));

        assertThat(resolver.resolve(record, NOW)).isEqualTo(AccessState.active);
    }

    @Test
    void pastDueWithinPeriodStillActive() {
        SubscriptionEntity record = record(SubscriptionStatus.past_due, NOW.plus(Duration.ofHours(1)));

        assertThat(resolver.resolve(record, NOW)).isEqualTo(AccessState.active);
    }

    @Test
    void trialBeforeEndIsTrialAndNeverEntersGrace() {
        SubscriptionEntity running = record(SubscriptionStatus.trial, NOW.plus(Duration.ofDays(1)));
        SubscriptionEntity ended = record(SubscriptionStatus.trial, NOW.minus(Duration.ofHours(1)));

        assertThat(resolver.resolve(running, NOW)).isEqualTo(AccessState.trial);
        assertThat(resolver.resolve(ended, NOW)).isEqualTo(AccessState.expired);
        assertThat(resolver.graceUntil(ended)).isNull();
    }

    @Test
    void graceCoversWindowAfterPeriodEndInclusive() {
        Instant end = NOW.minus(Duration.ofDays(5));
        SubscriptionEntity record = record(SubscriptionStatus.active, end);

        assertThat(resolver.resolve(record, NOW)).isEqualTo(AccessState.grace);
        assertThat(resolver.resolve(record, NOW.plusSeconds(1))).isEqualTo(AccessState.expired);
        assertThat(resolver.graceUntil(record)).isEqualTo(NOW);
    }

    @Test
    void cancelledRecordGetsGraceAndIsNonRenewing() {
        SubscriptionEntity record = record(SubscriptionStatus.cancelled, NOW.minus(Duration.ofDays(1)));

        SubscriptionView view = resolver.view(record.getAccountId(), record, NOW);

        assertThat(view.state()).isEqualTo(AccessState.grace);
        assertThat(view.active()).isTrue();
        assertThat(view.nonRenewing()).isTrue();
        assertThat(view.graceUntil()).isEqualTo(record.getPeriodEnd().plus(Duration.ofDays(5)));
    }

    @Test
    void periodEndedFortyDaysAgoIsExpired() {
        SubscriptionEntity record = record(SubscriptionStatus.active, NOW.minus(Duration.ofDays(40)));

        SubscriptionView view = resolver.view(record.getAccountId(), record, NOW);

        assertThat(view.state()).isEqualTo(AccessState.expired);
        assertThat(view.active()).isFalse();
    }

    @Test
    void expiredStatusNeverGrantsAccess() {
        SubscriptionEntity record = record(SubscriptionStatus.expired, NOW.plus(Duration.ofDays(3)));

        assertThat(resolver.resolve(record, NOW)).isEqualTo(AccessState.expired);
        assertThat(resolver.graceUntil(record)).isNull();
    }

    private static SubscriptionEntity record(SubscriptionStatus status, Instant periodEnd) {
        return new SubscriptionEntity(
                UUID.randomUUID(),
                "monthly",
                status,
                periodEnd.minus(Duration.ofDays(30)),
                periodEnd,
                periodEnd.minus(Duration.ofDays(30))
        );
    }
}
