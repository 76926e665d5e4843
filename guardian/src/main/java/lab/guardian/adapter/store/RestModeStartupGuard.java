package lab.guardian.adapter.store;

import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "guardian.store", name = "mode", havingValue = "rest")
public class RestModeStartupGuard {

    @Value("${guardian.store.rest.url:}")
    private String url;

    @Value("${guardian.store.rest.service-key:}")
    private String serviceKey;

    @PostConstruct
    void validate() {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("GUARDIAN_STORE_URL must be configured in rest mode");
        }
        if (serviceKey == null || serviceKey.isBlank()) {
            throw new IllegalStateException("GUARDIAN_STORE_SERVICE_KEY must be configured in rest mode");
        }
    }
}
