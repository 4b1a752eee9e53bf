package ch.so.arp.rag.hybrid;

/**
 * Output format requested from the generator.
 */
public enum ResponseFormat {
    TEXT,
    JSON_OBJECT
}
