package com.z254.butterfly.scout.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.scout.exception.ContextPathException;
import com.z254.butterfly.scout.exception.ScoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide in-memory implementation of {@link SharedContextManager}.
 *
 * <p>Entries live in a single concurrent map keyed by path. A write is committed inside
 * {@link ConcurrentHashMap#compute}, so writes to the same path are linearized while writes to
 * different paths proceed independently. Watch notifications are enqueued while the path is
 * locked, which keeps each path's notifications in commit order, and are delivered on a
 * separate scheduler so writers never wait for subscribers.
 *
 * <p>Writers share the read side of {@code registrationLock}; registering a watch takes the write
 * side for the short time needed to snapshot existing entries, so a new watch either sees a
 * write in its replay or receives it live.
 */
@Component
@Slf4j
public class InMemorySharedContextManager implements SharedContextManager {

    private final Map<ContextPath, ContextEntry> entries = new ConcurrentHashMap<>();
    private final Set<WatchSubscription> watches = ConcurrentHashMap.newKeySet();
    private final ReadWriteLock registrationLock = new ReentrantReadWriteLock();

    private final Scheduler dispatchScheduler;
    private final ObjectMapper objectMapper;
    private final Counter writeCounter;

    public InMemorySharedContextManager() {
        this(new ObjectMapper(), new SimpleMeterRegistry());
    }

    @Autowired
    public InMemorySharedContextManager(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.dispatchScheduler = Schedulers.boundedElastic();
        this.writeCounter = Counter.builder("scout.context.writes")
                .description("Total shared context writes")
                .register(meterRegistry);
        Gauge.builder("scout.context.entries", entries, Map::size)
                .description("Entries currently held in the shared context")
                .register(meterRegistry);
        Gauge.builder("scout.context.watches", watches, Set::size)
                .description("Active context watch subscriptions")
                .register(meterRegistry);
        log.info("Initialized InMemorySharedContextManager");
    }

    @Override
    public long set(String path, Object value, String writer) {
        ContextPath contextPath = ContextPath.of(path);
        if (contextPath.isRoot()) {
            throw new ContextPathException("Cannot write to the root path", path);
        }
        Objects.requireNonNull(value, "Context value must not be null");

        long[] committedVersion = new long[1];
        registrationLock.readLock().lock();
        try {
            entries.compute(contextPath, (key, existing) -> {
                long version = existing == null ? 1 : existing.getVersion() + 1;
                ContextEntry entry = ContextEntry.builder()
                        .path(key)
                        .value(value)
                        .version(version)
                        .writer(writer)
                        .updatedAt(Instant.now())
                        .build();
                notifyWatches(entry);
                committedVersion[0] = version;
                return entry;
            });
        } finally {
            registrationLock.readLock().unlock();
        }

        writeCounter.increment();
        log.debug("Set context value at {} (v{}) by {}", contextPath, committedVersion[0], writer);
        return committedVersion[0];
    }

    @Override
    public Optional<Object> get(String path) {
        return getEntry(path).map(ContextEntry::getValue);
    }

    @Override
    public Optional<ContextEntry> getEntry(String path) {
        return Optional.ofNullable(entries.get(ContextPath.of(path)));
    }

    @Override
    public Map<String, Object> getSubtree(String prefix) {
        ContextPath root = ContextPath.of(prefix);
        Map<String, Object> subtree = new TreeMap<>();
        entries.forEach((path, entry) -> {
            if (root.isPrefixOf(path)) {
                subtree.put(path.toString(), entry.getValue());
            }
        });
        return subtree;
    }

    @Override
    public boolean hasAny(String prefix) {
        ContextPath root = ContextPath.of(prefix);
        return entries.keySet().stream().anyMatch(root::isPrefixOf);
    }

    @Override
    public Map<String, Object> getTree(String prefix) {
        ContextPath root = ContextPath.of(prefix);
        Map<String, Object> tree = new TreeMap<>();
        entries.values().stream()
                .filter(entry -> root.isPrefixOf(entry.getPath()))
                .sorted(Comparator.comparing(ContextEntry::getPath))
                .forEach(entry -> insert(tree, root.relativize(entry.getPath()).getSegments(), entry.getValue()));
        return tree;
    }

    @Override
    public Flux<ContextEntry> watch(String prefix) {
        ContextPath root = ContextPath.of(prefix);
        return Flux.defer(() -> {
            WatchSubscription subscription = register(root);
            return subscription.sink.asFlux()
                    .publishOn(dispatchScheduler)
                    .doFinally(signal -> {
                        subscription.cancel();
                        watches.remove(subscription);
                        log.debug("Watch on '{}' ended ({})", root, signal);
                    });
        });
    }

    @Override
    public int remove(String prefix) {
        ContextPath root = ContextPath.of(prefix);
        int removed;
        registrationLock.writeLock().lock();
        try {
            int before = entries.size();
            entries.keySet().removeIf(root::isPrefixOf);
            removed = Math.max(0, before - entries.size());
            // A re-created path restarts at version 1; watches must accept it again.
            watches.forEach(subscription -> subscription.forget(root));
        } finally {
            registrationLock.writeLock().unlock();
        }
        log.debug("Removed {} context entries under '{}'", removed, root);
        return removed;
    }

    @Override
    public SharedContextManager scoped(String prefix) {
        return new ScopedContextView(this, ContextPath.of(prefix));
    }

    @Override
    public int size() {
        return entries.size();
    }

    /**
     * Serialize the whole store as nested JSON.
     */
    public String dump() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(getTree(""));
        } catch (JsonProcessingException e) {
            throw new ScoutException("Failed to serialize shared context", Map.of(), e);
        }
    }

    /**
     * Load nested JSON produced by {@link #dump()}. Every leaf becomes an entry; existing
     * entries with the same path are overwritten and watches fire as for any write.
     *
     * @return number of entries written
     */
    public int load(String json, String writer) {
        try {
            JsonNode root = objectMapper.readTree(json);
            int written = load(ContextPath.ROOT, root, writer);
            log.info("Loaded {} context entries from JSON", written);
            return written;
        } catch (JsonProcessingException e) {
            throw new ScoutException("Failed to parse shared context JSON", Map.of(), e);
        }
    }

    /**
     * Complete every open watch. Entries stay readable.
     */
    @PreDestroy
    public void close() {
        watches.forEach(WatchSubscription::complete);
        watches.clear();
        log.info("Closed all context watches");
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private WatchSubscription register(ContextPath root) {
        WatchSubscription subscription = new WatchSubscription(root);
        registrationLock.writeLock().lock();
        try {
            watches.add(subscription);
            entries.values().stream()
                    .filter(entry -> root.isPrefixOf(entry.getPath()))
                    .sorted(Comparator.comparing(ContextEntry::getPath))
                    .forEach(subscription::offer);
        } finally {
            registrationLock.writeLock().unlock();
        }
        log.debug("Registered watch on '{}'", root);
        return subscription;
    }

    private void notifyWatches(ContextEntry entry) {
        for (WatchSubscription subscription : watches) {
            if (subscription.prefix.isPrefixOf(entry.getPath())) {
                subscription.offer(entry);
            }
        }
    }

    private int load(ContextPath path, JsonNode node, String writer) throws JsonProcessingException {
        if (node.isObject()) {
            int written = 0;
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                ContextPath target = NODE_VALUE_KEY.equals(field.getKey()) ? path : path.resolve(field.getKey());
                written += load(target, field.getValue(), writer);
            }
            return written;
        }
        if (path.isRoot() || node.isNull()) {
            return 0;
        }
        set(path.toString(), objectMapper.treeToValue(node, Object.class), writer);
        return 1;
    }

    @SuppressWarnings("unchecked")
    private static void insert(Map<String, Object> tree, List<String> segments, Object value) {
        if (segments.isEmpty()) {
            tree.put(NODE_VALUE_KEY, value);
            return;
        }
        Map<String, Object> node = tree;
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            Object child = node.get(segment);
            if (!(child instanceof Map)) {
                Map<String, Object> branch = new TreeMap<>();
                if (child != null) {
                    branch.put(NODE_VALUE_KEY, child);
                }
                node.put(segment, branch);
                child = branch;
            }
            node = (Map<String, Object>) child;
        }
        String leaf = segments.get(segments.size() - 1);
        Object existing = node.get(leaf);
        if (existing instanceof Map && !(value instanceof Map)) {
            ((Map<String, Object>) existing).put(NODE_VALUE_KEY, value);
        } else {
            node.put(leaf, value);
        }
    }

    /**
     * One watch registration. Offers are serialized per subscription; an entry whose version
     * is not newer than the last one offered for its path is dropped.
     */
    private static final class WatchSubscription {

        final ContextPath prefix;
        final Sinks.Many<ContextEntry> sink = Sinks.many().unicast().onBackpressureBuffer();
        private final Map<ContextPath, Long> lastVersions = new HashMap<>();
        private boolean cancelled;

        WatchSubscription(ContextPath prefix) {
            this.prefix = prefix;
        }

        synchronized void offer(ContextEntry entry) {
            if (cancelled) {
                return;
            }
            Long last = lastVersions.get(entry.getPath());
            if (last != null && last >= entry.getVersion()) {
                return;
            }
            lastVersions.put(entry.getPath(), entry.getVersion());
            Sinks.EmitResult result = sink.tryEmitNext(entry);
            if (result.isFailure()) {
                log.warn("Failed to deliver context change {} to watch on '{}': {}",
                        entry.getPath(), prefix, result);
            }
        }

        synchronized void forget(ContextPath removed) {
            lastVersions.keySet().removeIf(removed::isPrefixOf);
        }

        synchronized void cancel() {
            cancelled = true;
            lastVersions.clear();
        }

        synchronized void complete() {
            cancelled = true;
            sink.tryEmitComplete();
        }
    }
}
