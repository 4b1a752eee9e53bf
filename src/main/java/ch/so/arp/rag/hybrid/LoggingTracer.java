package ch.so.arp.rag.hybrid;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Tracer} that writes spans to the application log.
 */
class LoggingTracer implements Tracer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTracer.class);

    @Override
    public SpanHandle startSpan(RequestContext context, String name, Map<String, Object> input) {
        LOGGER.debug("span_start name={} request={} trace={} input={}", name, context.requestId(),
                context.traceId(), input);
        return (metadata, output) -> LOGGER.info("span_end name={} request={} trace={} metadata={} output={}", name,
                context.requestId(), context.traceId(), metadata, output);
    }
}
