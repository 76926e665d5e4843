package lab.guardian.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UpdateApprovalRequest(
        @JsonProperty("status") String status,
        @JsonProperty("final_tx_hash") String finalTxHash,
        @JsonProperty("error_message") String errorMessage
) {}
