package lab.guardian.domain.apikey;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of {@code api_keys}. Only the SHA-256 hex of the raw key is stored.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiKey {

    public static final String TABLE = "api_keys";

    private UUID id;
    private String walletAddress;
    private String keyHash;
    private Instant createdAt;
    private Instant revokedAt;

    @JsonIgnore
    public boolean isRevoked() {
        return revokedAt != null;
    }
}
