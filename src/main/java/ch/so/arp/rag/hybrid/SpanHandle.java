package ch.so.arp.rag.hybrid;

import java.util.Map;

/**
 * An open span. {@link #end(Map, Object)} must be called once.
 */
public interface SpanHandle {

    void end(Map<String, Object> metadata, Object output);
}
