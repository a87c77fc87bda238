package app.taxguide.ask.billing.controller;

import app.taxguide.ask.billing.service.PaymentFulfillmentService;
import app.taxguide.ask.billing.service.WebhookResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/webhooks/paystack")
public class PaystackWebhookController {

    static final String SIGNATURE_HEADER = "x-paystack-signature";

    private final PaymentFulfillmentService fulfillmentService;

    public PaystackWebhookController(PaymentFulfillmentService fulfillmentService) {
        this.fulfillmentService = fulfillmentService;
    }

    // POST /webhooks/paystack
    @PostMapping
    public ResponseEntity<WebhookResult> handle(
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) byte[] rawBody
    ) {
        WebhookResult result = fulfillmentService.handleNotification(rawBody == null ? new byte[0] : rawBody,
                signature);
        // Paystack retries on non-2xx
        HttpStatus status = result.acknowledged() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(result);
    }
}
