package lab.guardian.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateApprovalRequest(
        @JsonProperty("wallet_address") String walletAddress,
        @JsonProperty("action") String action,
        @JsonProperty("token") String token,
        @JsonProperty("amount") String amount,
        @JsonProperty("recipient") String recipient,
        @JsonProperty("calls_json") String callsJson,
        @JsonProperty("sig1_json") String sig1Json,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("resource_bounds_json") String resourceBoundsJson,
        @JsonProperty("tx_hash") String txHash
) {}
