package com.z254.butterfly.scout.context;

import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.Optional;

/**
 * Hierarchical key/value store shared by the agents of a run.
 * Keys are slash-delimited {@link ContextPath}s; every write bumps the path's version and
 * notifies the watches registered on the path or any of its ancestors.
 */
public interface SharedContextManager {

    /**
     * Key under which {@link #getTree(String)} keeps the value of a node that also has children.
     */
    String NODE_VALUE_KEY = "_value";

    /**
     * Write a value. Last writer wins; matching watches are notified asynchronously.
     *
     * @param path   the path to write, must not be the root
     * @param value  the value, never null
     * @param writer identity of the writer
     * @return the new version of the path
     */
    long set(String path, Object value, String writer);

    /**
     * Get the latest committed value.
     *
     * @param path the path
     * @return the value, or empty if the path was never written
     */
    Optional<Object> get(String path);

    /**
     * Get the latest committed value cast to the expected type.
     *
     * @param path the path
     * @param type the expected type
     * @return the value, or empty if absent or of another type
     */
    default <T> Optional<T> get(String path, Class<T> type) {
        return get(path).filter(type::isInstance).map(type::cast);
    }

    /**
     * Get the full entry (value, version, writer, timestamp).
     *
     * @param path the path
     * @return the entry, or empty if the path was never written
     */
    Optional<ContextEntry> getEntry(String path);

    /**
     * All entries at or under a prefix.
     *
     * @param prefix the path prefix, blank for everything
     * @return path to value, sorted by path
     */
    Map<String, Object> getSubtree(String prefix);

    /**
     * Check whether at least one entry exists at or under a prefix.
     *
     * @param prefix the path prefix
     * @return true if anything was written under the prefix
     */
    default boolean hasAny(String prefix) {
        return !getSubtree(prefix).isEmpty();
    }

    /**
     * The subtree under a prefix as nested maps keyed by segment. A node that holds a value
     * and also has children keeps its own value under {@link #NODE_VALUE_KEY}.
     *
     * @param prefix the path prefix
     * @return nested map rooted at the prefix
     */
    Map<String, Object> getTree(String prefix);

    /**
     * Watch a prefix. Each call is an independent subscription, registered on subscribe.
     * The latest value of every existing entry under the prefix is replayed first, then
     * every committed write is delivered. Per path, versions are strictly increasing.
     * Cancelling the subscription frees it immediately.
     *
     * @param prefix the path prefix, blank for everything
     * @return infinite stream of committed entries
     */
    Flux<ContextEntry> watch(String prefix);

    /**
     * Delete every entry at or under a prefix. Watches receive no event for the removal, but a
     * later write to a removed path is delivered to them even though its version restarts at 1.
     *
     * @param prefix the path prefix
     * @return number of removed entries
     */
    int remove(String prefix);

    /**
     * A view rooted at a prefix: every path passed to the view is resolved under it and
     * every path returned is relative to it.
     *
     * @param prefix the root of the view
     * @return the scoped view
     */
    SharedContextManager scoped(String prefix);

    /**
     * Number of entries visible through this manager.
     */
    int size();
}
