package app.taxguide.ask.subscription.controller;

import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.service.SubscriptionService;
import app.taxguide.ask.subscription.service.SubscriptionService.TrialResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    public SubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    // GET /subscriptions/{accountId}
    @GetMapping("/{accountId}")
    public SubscriptionView status(@PathVariable UUID accountId) {
        return subscriptionService.status(accountId);
    }

    // POST /subscriptions/{accountId}/trial
    @PostMapping("/{accountId}/trial")
    public TrialResult startTrial(@PathVariable UUID accountId) {
        return subscriptionService.startTrial(accountId);
    }

    // POST /subscriptions/{accountId}/schedule
    @PostMapping("/{accountId}/schedule")
    public SubscriptionView schedule(@PathVariable UUID accountId,
                                     @Valid @RequestBody ScheduleRequest request) {
        return subscriptionService.schedule(accountId, request.planCode());
    }

    public record ScheduleRequest(@NotBlank String planCode) {
    }
}
