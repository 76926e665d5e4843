package lab.guardian.domain.swap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Row of {@code swap_executions}. Linked to transactions only through the hashes it touched.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SwapExecution {

    public static final String TABLE = "swap_executions";

    private String executionId;
    private String walletAddress;
    private String wardAddress;
    private String txHash;
    private String primaryTxHash;
    private List<String> txHashes;
    private String provider;
    private String sellToken;
    private String buyToken;
    private String sellAmountWei;
    private String estimatedBuyAmountWei;
    private String minBuyAmountWei;
    private String buyActualAmountWei;
    private String failureStepKey;
    private String failureReason;
    private String status;
    private Instant createdAt;

    /** Every non-empty hash this execution touched, in {@code tx_hash, primary_tx_hash, tx_hashes} order. */
    public Set<String> touchedTxHashes() {
        Set<String> hashes = new LinkedHashSet<>();
        addIfPresent(hashes, txHash);
        addIfPresent(hashes, primaryTxHash);
        if (txHashes != null) {
            txHashes.forEach(hash -> addIfPresent(hashes, hash));
        }
        return hashes;
    }

    private static void addIfPresent(Set<String> hashes, String hash) {
        if (hash != null && !hash.isBlank()) {
            hashes.add(hash);
        }
    }
}
