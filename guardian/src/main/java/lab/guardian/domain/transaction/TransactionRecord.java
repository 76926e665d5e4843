package lab.guardian.domain.transaction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of {@code transactions}. Written by the submitting client; this service only reads it, so
 * {@code status} and {@code accountType} stay as stored text ({@code pending|confirmed|failed},
 * {@code normal|ward|guardian}).
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionRecord {

    public static final String TABLE = "transactions";

    private String id;
    private String walletAddress;
    private String txHash;
    private String type;
    private String token;
    private String amount;
    private String amountUnit;
    private String recipient;
    private String recipientName;
    private String note;
    private String status;
    private String errorMessage;
    private String accountType;
    private String wardAddress;
    private String fee;
    private String network;
    private String platform;
    private Instant createdAt;
}
