package com.docclassifier.observability;

import com.docclassifier.util.Strings;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wraps pipeline stages in OpenTelemetry spans. Uses {@link GlobalOpenTelemetry}, which is a
 * no-op until an agent or SDK installs a real implementation.
 */
@Service
public class TracingService {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    private final Tracer tracer;

    public TracingService() {
        this.tracer = GlobalOpenTelemetry.getTracer("com.docclassifier", "0.1.0");
        logger.debug("TracingService initialized with OpenTelemetry tracer");
    }

    /**
     * Execute a function within a span, recording any exception on it.
     */
    public <T> T trace(@Nonnull String spanName, @Nonnull Map<String, String> attributes, @Nonnull Supplier<T> operation) {
        Span span = tracer.spanBuilder(Strings.tagValue(spanName)).startSpan();
        attributes.forEach((key, value) -> span.setAttribute(key, Strings.tagValue(value)));
        try (Scope scope = span.makeCurrent()) {
            return operation.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setAttribute("error", true);
            span.setAttribute("error.message", Strings.tagValue(e.getMessage()));
            throw e;
        } finally {
            span.end();
        }
    }

    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        return trace(spanName, Map.of(), operation);
    }

    public Span getCurrentSpan() {
        return Span.current();
    }
}
