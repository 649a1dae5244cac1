package io.ringcluster.cluster.membership.crdt;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Delta-state Observed-Remove Set.
 * <p>
 * Every add mints a fresh {@link Dot}; a remove tombstones only the dots it has observed, so an add
 * this replica has not seen yet survives the remove. {@link #join(Delta)} is a union of add-dots and
 * tombstones, which makes it idempotent, commutative and associative. Not thread-safe; the owner
 * serializes access.
 * <p>
 * Tombstones are never collected.
 */
public final class OrSet<E> {

    private final String replicaId;
    private final Map<E, Set<Dot>> adds = new HashMap<>();
    private final Map<E, Set<Dot>> removes = new HashMap<>();
    private long counter;

    public OrSet(final String replicaId) {
        this.replicaId = Objects.requireNonNull(replicaId, "replicaId");
    }

    public String replicaId() {
        return replicaId;
    }

    /** Highest counter minted by, or observed for, this replica id. */
    public long counter() {
        return counter;
    }

    /**
     * Adds {@code element} under a fresh dot and returns the delta describing exactly that dot.
     */
    public Delta<E> add(final E element) {
        Objects.requireNonNull(element, "element");
        final Dot dot = new Dot(replicaId, ++counter);
        adds.computeIfAbsent(element, k -> new HashSet<>()).add(dot);
        return new Delta<>(Map.of(element, Set.of(dot)), Map.of());
    }

    /**
     * Tombstones every live dot of {@code element}.
     *
     * @return the tombstone delta, or empty if the element is not currently present
     */
    public Optional<Delta<E>> remove(final E element) {
        final Set<Dot> live = liveDots(element);
        if (live.isEmpty()) return Optional.empty();

        removes.computeIfAbsent(element, k -> new HashSet<>()).addAll(live);
        return Optional.of(new Delta<>(Map.of(), Map.of(element, live)));
    }

    /**
     * Merges a delta or a full snapshot.
     *
     * @return true if local state changed
     */
    public boolean join(final Delta<E> delta) {
        boolean changed = merge(adds, delta.adds());
        changed |= merge(removes, delta.removes());
        return changed;
    }

    public boolean contains(final E element) {
        return !liveDots(element).isEmpty();
    }

    /** Elements with at least one add-dot that is not tombstoned. */
    public Set<E> elements() {
        final Set<E> out = new HashSet<>();
        for (final E element : adds.keySet()) {
            if (contains(element)) out.add(element);
        }
        return out;
    }

    /** Full replica state, suitable for bootstrapping a peer that has seen nothing yet. */
    public Delta<E> snapshot() {
        return new Delta<>(adds, removes);
    }

    private Set<Dot> liveDots(final E element) {
        final Set<Dot> added = adds.get(element);
        if (added == null) return Set.of();

        final Set<Dot> removed = removes.getOrDefault(element, Set.of());
        final Set<Dot> live = new HashSet<>();
        for (final Dot d : added) {
            if (!removed.contains(d)) live.add(d);
        }
        return live;
    }

    private boolean merge(final Map<E, Set<Dot>> into, final Map<E, Set<Dot>> from) {
        boolean changed = false;
        for (final Map.Entry<E, Set<Dot>> e : from.entrySet()) {
            final Set<Dot> target = into.computeIfAbsent(e.getKey(), k -> new HashSet<>());
            for (final Dot dot : e.getValue()) {
                if (target.add(dot)) {
                    changed = true;
                    /* a restarted replica must never mint a dot that is already out there */
                    if (dot.origin().equals(replicaId) && dot.counter() > counter) {
                        counter = dot.counter();
                    }
                }
            }
            if (target.isEmpty()) into.remove(e.getKey());
        }
        return changed;
    }

    @Override
    public String toString() {
        return "OrSet{" + replicaId + ", elements=" + elements() + "}";
    }
}
