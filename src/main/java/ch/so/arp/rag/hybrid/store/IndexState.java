package ch.so.arp.rag.hybrid.store;

/**
 * Lifecycle of the in-memory vector index.
 */
public enum IndexState {
    ABSENT,
    LOADED,
    REBUILDING
}
