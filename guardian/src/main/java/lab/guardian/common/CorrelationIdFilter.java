package lab.guardian.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a correlation id ({@code X-Correlation-Id}, generated when absent) and puts
 * it into the MDC with the caller and the wallet the request is about.
 * {@code clientId} starts as {@code anonymous} and is replaced by the API key id once authenticated.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String MDC_CORRELATION_ID_KEY = "correlationId";
    public static final String MDC_CLIENT_ID_KEY = "clientId";
    public static final String MDC_USER_ID_KEY = "userId";

    private static final String[] WALLET_PARAMETERS = {"wallet", "ward", "guardian"};

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MDC_CORRELATION_ID_KEY, correlationId);
        MDC.put(MDC_CLIENT_ID_KEY, "anonymous");
        MDC.put(MDC_USER_ID_KEY, resolveWallet(request));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_CORRELATION_ID_KEY);
            MDC.remove(MDC_CLIENT_ID_KEY);
            MDC.remove(MDC_USER_ID_KEY);
        }
    }

    private String resolveCorrelationId(String incoming) {
        if (incoming == null) {
            return UUID.randomUUID().toString();
        }
        String trimmed = incoming.trim();
        return trimmed.isEmpty() ? UUID.randomUUID().toString() : trimmed;
    }

    private String resolveWallet(HttpServletRequest request) {
        for (String name : WALLET_PARAMETERS) {
            String value = request.getParameter(name);
            if (value != null && !value.isBlank()) {
                return Addresses.normalize(value);
            }
        }
        return "-";
    }
}
