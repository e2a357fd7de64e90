package com.z254.butterfly.scout.context;

import com.z254.butterfly.scout.exception.ContextPathException;
import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * View of a {@link SharedContextManager} rooted at a fixed prefix.
 * The orchestrator hands each run's agents a view rooted at the run id, so agents address
 * {@code repo/files} while the store holds {@code <runId>/repo/files}.
 */
public class ScopedContextView implements SharedContextManager {

    private final SharedContextManager delegate;
    private final ContextPath root;

    ScopedContextView(SharedContextManager delegate, ContextPath root) {
        this.delegate = delegate;
        this.root = root;
    }

    public ContextPath getRoot() {
        return root;
    }

    @Override
    public long set(String path, Object value, String writer) {
        if (ContextPath.of(path).isRoot()) {
            throw new ContextPathException("Cannot write to the root of a scoped view", path);
        }
        return delegate.set(resolve(path), value, writer);
    }

    @Override
    public Optional<Object> get(String path) {
        return delegate.get(resolve(path));
    }

    @Override
    public Optional<ContextEntry> getEntry(String path) {
        return delegate.getEntry(resolve(path)).map(this::relativize);
    }

    @Override
    public Map<String, Object> getSubtree(String prefix) {
        Map<String, Object> relative = new TreeMap<>();
        delegate.getSubtree(resolve(prefix))
                .forEach((path, value) -> relative.put(root.relativize(ContextPath.of(path)).toString(), value));
        return relative;
    }

    @Override
    public boolean hasAny(String prefix) {
        return delegate.hasAny(resolve(prefix));
    }

    @Override
    public Map<String, Object> getTree(String prefix) {
        return delegate.getTree(resolve(prefix));
    }

    @Override
    public Flux<ContextEntry> watch(String prefix) {
        return delegate.watch(resolve(prefix)).map(this::relativize);
    }

    @Override
    public int remove(String prefix) {
        return delegate.remove(resolve(prefix));
    }

    @Override
    public SharedContextManager scoped(String prefix) {
        return new ScopedContextView(delegate, root.resolve(prefix));
    }

    @Override
    public int size() {
        return delegate.getSubtree(root.toString()).size();
    }

    private String resolve(String path) {
        return root.resolve(path).toString();
    }

    private ContextEntry relativize(ContextEntry entry) {
        return entry.toBuilder().path(root.relativize(entry.getPath())).build();
    }
}
