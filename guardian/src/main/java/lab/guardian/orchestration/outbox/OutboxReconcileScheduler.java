package lab.guardian.orchestration.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "guardian.outbox.reconcile", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class OutboxReconcileScheduler {

    private final OutboxReconciler reconciler;

    @Scheduled(
            fixedDelayString = "${guardian.outbox.reconcile.interval-ms:60000}",
            initialDelayString = "${guardian.outbox.reconcile.interval-ms:60000}"
    )
    public void run() {
        try {
            reconciler.reconcile(null, null, false);
        } catch (RuntimeException e) {
            // Next tick retries the same window.
            log.warn("event=ward_outbox.reconcile.tick_failed error={}", e.getMessage());
        }
    }
}
