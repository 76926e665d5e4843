package lab.guardian.orchestration.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequiredArgsConstructor
@RequestMapping("/internal/outbox")
@Slf4j
public class OutboxController {

    private final OutboxReconciler reconciler;

    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileSummary> reconcile(
            @RequestParam(name = "updated_after", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant updatedAfter,
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "dry_run", defaultValue = "false") boolean dryRun
    ) {
        log.info("event=ward_outbox.reconcile.request updatedAfter={} limit={} dryRun={}", updatedAfter, limit, dryRun);
        return ResponseEntity.ok(reconciler.reconcile(updatedAfter, limit, dryRun));
    }
}
