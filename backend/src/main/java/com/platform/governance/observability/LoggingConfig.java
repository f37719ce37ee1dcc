package com.platform.governance.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * MDC keys shared by the log pattern, structured log events and error responses.
 * HTTP requests carry a correlation id; translation calls carry the event being translated.
 */
@Configuration
public class LoggingConfig {
    
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_EVENT_ID = "eventId";
    public static final String MDC_AI_SYSTEM_ID = "aiSystemId";
    
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    /**
     * Reuses the caller's X-Correlation-ID or mints one, and echoes it on the response.
     */
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        
        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            String header = request.getHeader(CORRELATION_ID_HEADER);
            String correlationId = header != null && !header.isBlank() ? header : UUID.randomUUID().toString();
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
            
            try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_CORRELATION_ID, correlationId)) {
                filterChain.doFilter(request, response);
            }
        }
    }
    
    public static void setEventContext(String eventId, String aiSystemId) {
        if (eventId != null) {
            MDC.put(MDC_EVENT_ID, eventId);
        }
        if (aiSystemId != null) {
            MDC.put(MDC_AI_SYSTEM_ID, aiSystemId);
        }
    }
    
    public static void clearEventContext() {
        MDC.remove(MDC_EVENT_ID);
        MDC.remove(MDC_AI_SYSTEM_ID);
    }
}
