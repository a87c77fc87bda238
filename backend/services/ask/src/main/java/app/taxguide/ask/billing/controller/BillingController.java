package app.taxguide.ask.billing.controller;

import app.taxguide.ask.billing.service.BillingSnapshotService;
import app.taxguide.ask.billing.service.BillingSnapshotService.BillingSnapshot;
import app.taxguide.ask.billing.service.CheckoutService;
import app.taxguide.ask.billing.service.CheckoutService.CheckoutResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/billing")
public class BillingController {

    private final CheckoutService checkoutService;
    private final BillingSnapshotService snapshotService;

    public BillingController(CheckoutService checkoutService, BillingSnapshotService snapshotService) {
        this.checkoutService = checkoutService;
        this.snapshotService = snapshotService;
    }

    // POST /billing/checkout
    @PostMapping("/checkout")
    public CheckoutResponse checkout(@Valid @RequestBody CheckoutRequest request) {
        return checkoutService.checkout(request.accountId(), request.planCode(), request.email(),
                request.upgradeMode());
    }

    // GET /billing/{accountId}
    @GetMapping("/{accountId}")
    public BillingSnapshot snapshot(@PathVariable UUID accountId) {
        return snapshotService.snapshot(accountId);
    }

    public record CheckoutRequest(
            @NotNull UUID accountId,
            @NotBlank String planCode,
            @NotBlank @Email String email,
            String upgradeMode
    ) {
    }
}
