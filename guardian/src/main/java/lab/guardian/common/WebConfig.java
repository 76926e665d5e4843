package lab.guardian.common;

import lab.guardian.common.auth.ApiKeyAuthInterceptor;
import lab.guardian.common.auth.ApiKeyAuthenticator;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final ApiKeyAuthenticator authenticator;

    @Value("${guardian.auth.enabled:true}")
    private boolean authEnabled;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!authEnabled) {
            return;
        }
        registry.addInterceptor(new ApiKeyAuthInterceptor(authenticator))
                .addPathPatterns("/ward-approvals/**", "/approvals/**", "/activity/**", "/internal/**");
    }
}
