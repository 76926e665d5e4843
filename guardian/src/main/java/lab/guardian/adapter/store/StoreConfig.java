package lab.guardian.adapter.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.time.Duration;

@Configuration
public class StoreConfig {

    // Default mode: everything lives in process memory, nothing external is needed.
    @Bean
    @ConditionalOnProperty(prefix = "guardian.store", name = "mode", havingValue = "memory", matchIfMissing = true)
    public InMemoryStoreAdapter inMemoryStoreAdapter(ObjectMapper objectMapper) {
        return new InMemoryStoreAdapter(objectMapper);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "guardian.store", name = "mode", havingValue = "rest")
    static class RestStoreConfig {

        @Bean
        public OkHttpClient storeHttpClient(
                @Value("${guardian.store.rest.connect-timeout-ms:5000}") long connectTimeoutMs,
                @Value("${guardian.store.rest.read-timeout-ms:10000}") long readTimeoutMs) {
            return new OkHttpClient.Builder()
                    .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                    .readTimeout(Duration.ofMillis(readTimeoutMs))
                    .build();
        }

        @Bean
        @DependsOn("restModeStartupGuard")
        public PostgrestStoreAdapter postgrestStoreAdapter(
                OkHttpClient storeHttpClient,
                @Value("${guardian.store.rest.url:}") String url,
                @Value("${guardian.store.rest.service-key:}") String serviceKey,
                ObjectMapper objectMapper) {
            return new PostgrestStoreAdapter(storeHttpClient, url, serviceKey, objectMapper);
        }
    }
}
