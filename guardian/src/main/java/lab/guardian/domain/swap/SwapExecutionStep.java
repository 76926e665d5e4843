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

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SwapExecutionStep {

    public static final String TABLE = "swap_execution_steps";

    private String executionId;
    private String stepKey;
    private int stepOrder;
    private int attempt;
    private String status;
    private String txHash;
    private String message;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant createdAt;
}
