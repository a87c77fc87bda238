package app.taxguide.ask.admin.controller;

import app.taxguide.ask.answer.service.TranslationDrainService;
import app.taxguide.ask.answer.service.TranslationDrainService.DrainResult;
import app.taxguide.ask.subscription.service.SubscriptionSweepService;
import app.taxguide.ask.subscription.service.SubscriptionSweepService.SweepResult;
import org.springframework.web.bind.annotation.*;

/**
 * Batch jobs run by an external scheduler.
 */
@RestController
@RequestMapping("/admin/jobs")
public class AdminJobsController {

    private final SubscriptionSweepService sweepService;
    private final TranslationDrainService drainService;

    public AdminJobsController(SubscriptionSweepService sweepService, TranslationDrainService drainService) {
        this.sweepService = sweepService;
        this.drainService = drainService;
    }

    // POST /admin/jobs/subscription-sweep
    @PostMapping("/subscription-sweep")
    public SweepResult sweep() {
        return sweepService.sweep();
    }

    // POST /admin/jobs/translation-drain?batchSize=25
    @PostMapping("/translation-drain")
    public DrainResult drain(@RequestParam(required = false) Integer batchSize) {
        return drainService.drain(batchSize);
    }
}
