package io.errordispatch.core.hierarchy;

import io.errordispatch.core.error.TagCycleException;
import io.errordispatch.core.model.Tag;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only graph of "child derives from parent" relations between {@link Tag}s.
 *
 * <p>One instance belongs to one pipeline configuration and is passed explicitly to the
 * dispatcher. Relations are added at configuration time with {@link #derive(Tag, Tag)} and
 * never removed; the graph is kept acyclic. {@link #freeze()} closes the write window once
 * configuration is complete.
 *
 * <p>Thread-safe: guarded by a {@link ReentrantReadWriteLock}, so any number of dispatching
 * threads may query concurrently while a configuration-time write takes the exclusive lock.
 */
public final class TagHierarchy {

    private static final Logger LOG = LoggerFactory.getLogger(TagHierarchy.class);

    private final Map<Tag, Set<Tag>> parents = new HashMap<>();
    private final Map<Tag, Set<Tag>> children = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean frozen;

    /**
     * Records that {@code child} derives from {@code parent}. Deriving an existing relation again
     * is a no-op.
     *
     * @param child the more specific tag
     * @param parent the broader tag
     * @return this hierarchy (fluent)
     * @throws TagCycleException if {@code child} equals {@code parent} or is already one of its
     *     ancestors; the hierarchy is left unchanged
     * @throws IllegalStateException if the hierarchy is frozen
     */
    public TagHierarchy derive(Tag child, Tag parent) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(parent, "parent must not be null");
        lock.writeLock().lock();
        try {
            if (frozen) {
                throw new IllegalStateException("Tag hierarchy is frozen; cannot derive '" + child + "' from '"
                        + parent + "'");
            }
            if (parents.getOrDefault(child, Set.of()).contains(parent)) {
                return this;
            }
            if (child.equals(parent) || walk(parent, parents).contains(child)) {
                throw new TagCycleException(child, parent);
            }
            parents.computeIfAbsent(child, t -> new LinkedHashSet<>()).add(parent);
            children.computeIfAbsent(parent, t -> new LinkedHashSet<>()).add(child);
            LOG.debug("Derived tag {} from {}", child, parent);
            return this;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Direct parents of {@code tag}, in derivation order. */
    public Set<Tag> parents(Tag tag) {
        lock.readLock().lock();
        try {
            Set<Tag> direct = parents.get(tag);
            return direct != null ? Collections.unmodifiableSet(new LinkedHashSet<>(direct)) : Set.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All tags {@code tag} derives from, directly or transitively, excluding {@code tag} itself.
     * Iteration order is nearest first (breadth-first over parents in derivation order).
     */
    public Set<Tag> ancestors(Tag tag) {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(walk(tag, parents));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All tags deriving from {@code tag}, directly or transitively, excluding {@code tag} itself.
     * Iteration order is nearest first.
     */
    public Set<Tag> descendants(Tag tag) {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(walk(tag, children));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** {@code true} if {@code child} equals {@code parent} or derives from it. */
    public boolean isa(Tag child, Tag parent) {
        return child.equals(parent) || ancestors(child).contains(parent);
    }

    /** Rejects further {@link #derive} calls. Idempotent. */
    public void freeze() {
        lock.writeLock().lock();
        try {
            frozen = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Number of tags that derive from at least one parent. */
    public int size() {
        lock.readLock().lock();
        try {
            return parents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds a lock.
    private static Set<Tag> walk(Tag start, Map<Tag, Set<Tag>> edges) {
        Set<Tag> seen = new LinkedHashSet<>();
        Deque<Tag> queue = new ArrayDeque<>(edges.getOrDefault(start, Set.of()));
        while (!queue.isEmpty()) {
            Tag next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(edges.getOrDefault(next, Set.of()));
            }
        }
        return seen;
    }
}
