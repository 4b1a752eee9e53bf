package ch.so.arp.rag.hybrid;

import java.util.Map;

/**
 * Observability collaborator receiving one named span per pipeline stage.
 */
public interface Tracer {

    SpanHandle startSpan(RequestContext context, String name, Map<String, Object> input);
}
