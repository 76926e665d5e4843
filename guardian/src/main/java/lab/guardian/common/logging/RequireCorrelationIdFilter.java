package lab.guardian.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import lab.guardian.common.CorrelationIdFilter;

import java.util.Map;

/**
 * Passes only events logged inside a request, i.e. with a correlation id in the MDC.
 * Attached to the request-flow file appender in {@code logback-spring.xml}; startup, scheduler and
 * fan-out worker logs stay on the console.
 */
public class RequireCorrelationIdFilter extends Filter<ILoggingEvent> {

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && mdc.containsKey(CorrelationIdFilter.MDC_CORRELATION_ID_KEY)) {
            return FilterReply.NEUTRAL;
        }
        return FilterReply.DENY;
    }
}
