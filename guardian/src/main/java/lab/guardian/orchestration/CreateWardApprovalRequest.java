package lab.guardian.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateWardApprovalRequest(
        @JsonProperty("ward_address") String wardAddress,
        @JsonProperty("guardian_address") String guardianAddress,
        @JsonProperty("action") String action,
        @JsonProperty("token") String token,
        @JsonProperty("amount") String amount,
        @JsonProperty("amount_unit") String amountUnit,
        @JsonProperty("recipient") String recipient,
        @JsonProperty("calls_json") String callsJson,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("resource_bounds_json") String resourceBoundsJson,
        @JsonProperty("tx_hash") String txHash,
        @JsonProperty("ward_sig_json") String wardSigJson,
        @JsonProperty("needs_ward_2fa") Boolean needsWard2fa,
        @JsonProperty("needs_guardian") Boolean needsGuardian,
        @JsonProperty("needs_guardian_2fa") Boolean needsGuardian2fa,
        @JsonProperty("initial_status") String initialStatus
) {}
