package lab.guardian.orchestration.activity;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ActivityPage(
        @JsonProperty("records") List<ActivityRecord> records,
        @JsonProperty("total") int total,
        @JsonProperty("has_more") boolean hasMore
) {}
