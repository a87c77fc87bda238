package app.taxguide.ask.subscription.service;

import app.taxguide.ask.config.AskProps;
import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.domain.entity.SubscriptionEntity;
import app.taxguide.ask.subscription.domain.type.AccessState;
import app.taxguide.ask.subscription.domain.type.SubscriptionStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Derives the access state of the current subscription record at a point in time. No I/O.
 */
@Component
public class SubscriptionStateResolver {

    private static final Set<SubscriptionStatus> GRACE_ELIGIBLE =
            EnumSet.of(SubscriptionStatus.active, SubscriptionStatus.past_due, SubscriptionStatus.cancelled);

    private final Duration graceWindow;

    @Autowired
    public SubscriptionStateResolver(AskProps props) {
        this(Duration.ofDays(Math.max(0, props.subscription().graceDays())));
    }

    public SubscriptionStateResolver(Duration graceWindow) {
        this.graceWindow = graceWindow;
    }

    public AccessState resolve(SubscriptionEntity current, Instant now) {
        if (current == null) {
            return AccessState.none;
        }
        SubscriptionStatus status = current.getStatus();
        if (now.isBefore(current.getPeriodEnd())) {
            return switch (status) {
                case trial -> AccessState.trial;
                case expired -> AccessState.expired;
                default -> AccessState.active;
            };
        }
        Instant graceUntil = graceUntil(current);
        if (graceUntil != null && !now.isAfter(graceUntil)) {
            return AccessState.grace;
        }
        return AccessState.expired;
    }

    /**
     * End of the grace window, or null when the record can never enter grace.
     */
    public Instant graceUntil(SubscriptionEntity current) {
        if (current == null || !GRACE_ELIGIBLE.contains(current.getStatus())) {
            return null;
        }
        return current.getPeriodEnd().plus(graceWindow);
    }

    public Duration graceWindow() {
        return graceWindow;
    }

    public SubscriptionView view(UUID accountId, SubscriptionEntity current, Instant now) {
        if (current == null) {
            return SubscriptionView.none(accountId);
        }
        AccessState state = resolve(current, now);
        boolean nonRenewing = state == AccessState.grace || current.getStatus() == SubscriptionStatus.cancelled;
        return new SubscriptionView(
                accountId,
                state.grantsAccess(),
                state,
                current.getPlanCode(),
                current.getPeriodEnd(),
                graceUntil(current),
                current.getPendingPlanCode(),
                current.getPendingEffectiveAt(),
                nonRenewing
        );
    }
}
