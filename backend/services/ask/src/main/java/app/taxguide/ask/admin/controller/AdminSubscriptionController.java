package app.taxguide.ask.admin.controller;

import app.taxguide.ask.subscription.domain.dto.SubscriptionView;
import app.taxguide.ask.subscription.service.SubscriptionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/admin/subscriptions")
public class AdminSubscriptionController {

    private final SubscriptionService subscriptionService;

    public AdminSubscriptionController(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    // POST /admin/subscriptions/activate
    @PostMapping("/activate")
    public SubscriptionView activate(@Valid @RequestBody ActivateRequest request) {
        return subscriptionService.activate(request.accountId(), request.planCode(), request.expiresAt());
    }

    public record ActivateRequest(@NotNull UUID accountId, @NotBlank String planCode, Instant expiresAt) {
    }
}
