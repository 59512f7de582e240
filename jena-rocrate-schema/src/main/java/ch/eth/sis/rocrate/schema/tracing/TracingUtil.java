package ch.eth.sis.rocrate.schema.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for OpenTelemetry spans around schema operations.
 *
 * <p>The library only uses the OpenTelemetry API. Spans are recorded by
 * whatever SDK the host application registered with
 * {@link GlobalOpenTelemetry}; without one every span is a no-op.</p>
 *
 * <p>Set {@code OTEL_TRACING_ENABLED=false} to turn span creation off
 * even when an SDK is registered.</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Environment variable to enable/disable tracing. */
    private static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Instrumentation scope name for graph building. */
    public static final String SCOPE_GRAPH_BUILDER =
        "ch.eth.sis.rocrate.schema.graph";

    /** Instrumentation scope name for the JSON-LD codec. */
    public static final String SCOPE_CODEC =
        "ch.eth.sis.rocrate.schema.jsonld";

    /** Instrumentation scope name for instance resolution. */
    public static final String SCOPE_RESOLVER =
        "ch.eth.sis.rocrate.schema.resolve";

    /** Number of Types involved in an operation. */
    public static final AttributeKey<Long> ATTR_TYPES =
        AttributeKey.longKey("rocrate.types");

    /** Number of metadata entries involved in an operation. */
    public static final AttributeKey<Long> ATTR_ENTRIES =
        AttributeKey.longKey("rocrate.entries");

    /** Number of triples produced or consumed. */
    public static final AttributeKey<Long> ATTR_TRIPLES =
        AttributeKey.longKey("rocrate.triples");

    /** Number of JSON-LD nodes produced or consumed. */
    public static final AttributeKey<Long> ATTR_NODES =
        AttributeKey.longKey("rocrate.nodes");

    /** Whether tracing is enabled; read once. */
    private static final boolean TRACING_ENABLED = readEnabled();

    /** Prevent instantiation. */
    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    private static boolean readEnabled() {
        String enabledEnv = System.getenv(ENV_TRACING_ENABLED);
        boolean enabled = enabledEnv == null || enabledEnv.isEmpty()
            || Boolean.parseBoolean(enabledEnv);
        if (!enabled && LOGGER.isInfoEnabled()) {
            LOGGER.info("OpenTelemetry tracing is disabled");
        }
        return enabled;
    }

    /**
     * Check if tracing is enabled.
     *
     * @return true if tracing is enabled, false otherwise
     */
    public static boolean isTracingEnabled() {
        return TRACING_ENABLED;
    }

    /**
     * Returns the OpenTelemetry instance spans are recorded with.
     *
     * @return the global instance, or a no-op one if tracing is disabled
     */
    public static OpenTelemetry getOpenTelemetry() {
        return TRACING_ENABLED ? GlobalOpenTelemetry.get() : OpenTelemetry.noop();
    }

    /**
     * Get a tracer for the specified instrumentation scope. The tracer is
     * looked up on every call so that an SDK registered later is picked up.
     *
     * @param scopeName the instrumentation scope name
     * @return the tracer for the given scope
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    /**
     * Runs an operation inside an internal span. The span status is set
     * from the outcome; exceptions are recorded and rethrown.
     *
     * @param scopeName the instrumentation scope name
     * @param spanName the span name
     * @param body the operation; receives the span to add attributes to
     * @param <T> the result type
     * @return the operation's result
     */
    public static <T> T inSpan(final String scopeName, final String spanName,
            final Function<Span, T> body) {
        Span span = getTracer(scopeName).spanBuilder(spanName)
            .setSpanKind(SpanKind.INTERNAL)
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            T result = body.apply(span);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
