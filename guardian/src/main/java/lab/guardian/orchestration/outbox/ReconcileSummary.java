package lab.guardian.orchestration.outbox;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ReconcileSummary(
        @JsonProperty("updated_after") Instant updatedAfter,
        @JsonProperty("scanned") int scanned,
        @JsonProperty("missing") int missing,
        @JsonProperty("enqueued") int enqueued,
        @JsonProperty("failed") int failed,
        @JsonProperty("dry_run") boolean dryRun
) {}
