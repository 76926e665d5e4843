package lab.guardian.orchestration.activity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the unified feed, built either from a {@code transactions} row or from a ward approval
 * that has no transaction yet.
 */
@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ActivityRecord {

    private final String id;
    private final ActivitySource source;
    private final String walletAddress;
    private final String txHash;
    private final String type;
    private final String token;
    private final String amount;
    private final String amountUnit;
    private final String recipient;
    private final String recipientName;
    private final String note;
    private final ActivityStatus status;
    private final String statusDetail;
    private final String errorMessage;
    private final String accountType;
    private final String wardAddress;
    private final String fee;
    private final String network;
    private final String platform;
    private final Instant createdAt;
    private final Instant respondedAt;
    private final Swap swap;

    public record Swap(
            @JsonProperty("execution_id") String executionId,
            @JsonProperty("provider") String provider,
            @JsonProperty("sell_token") String sellToken,
            @JsonProperty("buy_token") String buyToken,
            @JsonProperty("sell_amount_wei") String sellAmountWei,
            @JsonProperty("estimated_buy_amount_wei") String estimatedBuyAmountWei,
            @JsonProperty("min_buy_amount_wei") String minBuyAmountWei,
            @JsonProperty("buy_actual_amount_wei") String buyActualAmountWei,
            @JsonProperty("tx_hashes") List<String> txHashes,
            @JsonProperty("primary_tx_hash") String primaryTxHash,
            @JsonProperty("status") String status,
            @JsonProperty("failure_step_key") String failureStepKey,
            @JsonProperty("failure_reason") String failureReason,
            @JsonProperty("steps") List<Step> steps
    ) {}

    public record Step(
            @JsonProperty("step_key") String stepKey,
            @JsonProperty("step_order") int stepOrder,
            @JsonProperty("status") String status,
            @JsonProperty("tx_hash") String txHash,
            @JsonProperty("message") String message,
            @JsonProperty("started_at") Instant startedAt,
            @JsonProperty("finished_at") Instant finishedAt
    ) {}
}
