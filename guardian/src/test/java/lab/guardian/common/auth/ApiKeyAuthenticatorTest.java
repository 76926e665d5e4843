package lab.guardian.common.auth;

import lab.guardian.TestFixtures;
import lab.guardian.adapter.store.Filter;
import lab.guardian.adapter.store.InMemoryStoreAdapter;
import lab.guardian.adapter.store.SelectOptions;
import lab.guardian.adapter.store.StoreAdapter;
import lab.guardian.domain.apikey.ApiKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ApiKeyAuthenticatorTest {

    private static final String REVOKED_KEY = "revoked-key-0123456789abcdef";

    private StoreAdapter store;
    private ApiKeyAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryStoreAdapter(TestFixtures.objectMapper()));
        TestFixtures.seedApiKey(store);
        store.insert(ApiKey.TABLE, ApiKey.builder()
                .id(UUID.randomUUID())
                .walletAddress("0x2")
                .keyHash(ApiKeyAuthenticator.hash(REVOKED_KEY))
                .createdAt(Instant.now())
                .revokedAt(Instant.now())
                .build(), ApiKey.class);
        authenticator = new ApiKeyAuthenticator(store, 30_000, 10_000, 100);
    }

    @Test
    void validKeyResolvesWallet() {
        AuthContext context = authenticator.authenticate(TestFixtures.API_KEY);

        assertThat(context.walletAddress()).isEqualTo("0x1");
        assertThat(context.apiKeyId()).isNotNull();
    }

    @Test
    void rejectsMissingShortUnknownAndRevokedKeys() {
        assertThatThrownBy(() -> authenticator.authenticate(null))
                .isInstanceOf(AuthException.class)
                .hasMessage("Missing X-API-Key header");
        assertThatThrownBy(() -> authenticator.authenticate("short"))
                .isInstanceOf(AuthException.class)
                .hasMessage("Invalid API key format");
        assertThatThrownBy(() -> authenticator.authenticate("unknown-key-0123456789"))
                .isInstanceOf(AuthException.class)
                .hasMessage("Invalid API key");
        assertThatThrownBy(() -> authenticator.authenticate(REVOKED_KEY))
                .isInstanceOf(AuthException.class)
                .hasMessage("API key has been revoked");
    }

    @Test
    void outcomesAreCachedUntilInvalidated() {
        authenticator.authenticate(TestFixtures.API_KEY);
        authenticator.authenticate(TestFixtures.API_KEY);
        assertThatThrownBy(() -> authenticator.authenticate("unknown-key-0123456789")).isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> authenticator.authenticate("unknown-key-0123456789")).isInstanceOf(AuthException.class);

        verify(store, times(2)).select(eq(ApiKey.TABLE), any(Filter.class), any(SelectOptions.class), eq(ApiKey.class));

        authenticator.invalidateAll();
        authenticator.authenticate(TestFixtures.API_KEY);

        verify(store, times(3)).select(eq(ApiKey.TABLE), any(Filter.class), any(SelectOptions.class), eq(ApiKey.class));
    }
}
