package lab.guardian.common.auth;

import java.util.UUID;

/**
 * Caller identity resolved from the API key, exposed to handlers as a request attribute.
 */
public record AuthContext(String walletAddress, UUID apiKeyId) {

    public static final String REQUEST_ATTRIBUTE = AuthContext.class.getName();
}
