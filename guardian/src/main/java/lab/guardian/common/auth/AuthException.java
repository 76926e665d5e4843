package lab.guardian.common.auth;

public class AuthException extends RuntimeException {
    public AuthException(String message) {
        super(message);
    }
}
