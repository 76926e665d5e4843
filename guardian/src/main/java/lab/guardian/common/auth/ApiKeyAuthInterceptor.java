package lab.guardian.common.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.web.servlet.HandlerInterceptor;

import static lab.guardian.common.CorrelationIdFilter.MDC_CLIENT_ID_KEY;

@RequiredArgsConstructor
@Slf4j
public class ApiKeyAuthInterceptor implements HandlerInterceptor {

    public static final String API_KEY_HEADER = "X-API-Key";

    private final ApiKeyAuthenticator authenticator;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        AuthContext context = authenticator.authenticate(request.getHeader(API_KEY_HEADER));
        request.setAttribute(AuthContext.REQUEST_ATTRIBUTE, context);
        MDC.put(MDC_CLIENT_ID_KEY, String.valueOf(context.apiKeyId()));
        log.debug("event=auth.api_key.accepted apiKeyId={} path={}", context.apiKeyId(), request.getRequestURI());
        return true;
    }
}
