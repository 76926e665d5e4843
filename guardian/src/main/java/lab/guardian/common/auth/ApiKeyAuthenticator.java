package lab.guardian.common.auth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.domain.apikey.ApiKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;

/**
 * Resolves an {@code X-API-Key} value to the wallet it was issued for.
 * <p>
 * Only the SHA-256 hex of a key is stored and cached. Accepted and revoked keys are cached for
 * {@code guardian.auth.cache-ttl-ms}, unknown keys for the shorter {@code negative-cache-ttl-ms}.
 */
@Component
@Slf4j
public class ApiKeyAuthenticator {

    static final int MIN_KEY_LENGTH = 16;

    private final StoreAdapter store;
    private final Cache<String, Outcome> known;
    private final Cache<String, Outcome> unknown;

    public ApiKeyAuthenticator(
            StoreAdapter store,
            @Value("${guardian.auth.cache-ttl-ms:30000}") long cacheTtlMs,
            @Value("${guardian.auth.negative-cache-ttl-ms:10000}") long negativeCacheTtlMs,
            @Value("${guardian.auth.cache-max-entries:5000}") long maxEntries) {
        this.store = store;
        this.known = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(Duration.ofMillis(Math.max(1, cacheTtlMs)))
                .build();
        this.unknown = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(Duration.ofMillis(Math.max(1, negativeCacheTtlMs)))
                .build();
    }

    public AuthContext authenticate(String rawKey) {
        if (rawKey == null || rawKey.isEmpty()) {
            throw new AuthException("Missing X-API-Key header");
        }
        if (rawKey.length() < MIN_KEY_LENGTH) {
            throw new AuthException("Invalid API key format");
        }

        String keyHash = hash(rawKey);
        Outcome cached = known.getIfPresent(keyHash);
        if (cached == null) {
            cached = unknown.getIfPresent(keyHash);
        }
        if (cached == null) {
            cached = lookup(keyHash);
        }
        return cached.contextOrThrow();
    }

    /** Drops every cached outcome, e.g. after revoking a key. */
    public void invalidateAll() {
        known.invalidateAll();
        unknown.invalidateAll();
    }

    private Outcome lookup(String keyHash) {
        List<ApiKey> rows = store.select(ApiKey.TABLE, Filter.eq("key_hash", keyHash), SelectOptions.first(), ApiKey.class);
        if (rows.isEmpty()) {
            log.warn("event=auth.api_key.unknown");
            Outcome outcome = new Outcome(null, "Invalid API key");
            unknown.put(keyHash, outcome);
            return outcome;
        }
        ApiKey row = rows.get(0);
        if (row.isRevoked()) {
            log.warn("event=auth.api_key.revoked apiKeyId={}", row.getId());
            Outcome outcome = new Outcome(null, "API key has been revoked");
            known.put(keyHash, outcome);
            return outcome;
        }
        Outcome outcome = new Outcome(new AuthContext(row.getWalletAddress(), row.getId()), null);
        known.put(keyHash, outcome);
        return outcome;
    }

    public static String hash(String rawKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Outcome(AuthContext context, String rejection) {

        AuthContext contextOrThrow() {
            if (context == null) {
                throw new AuthException(rejection);
            }
            return context;
        }
    }
}
