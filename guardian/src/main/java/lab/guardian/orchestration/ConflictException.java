package lab.guardian.orchestration;

/**
 * A requested status change that is not reachable from the stored status.
 * Losing a compare-and-swap race is not reported with this exception.
 */
public class ConflictException extends RuntimeException {
    public ConflictException(String message) {
        super(message);
    }
}
