package io.ringcluster.cluster.membership.crdt;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Add-dots and remove-dots (tombstones) per element.
 * <p>
 * The same shape carries a single mutation and a full replica snapshot; {@link OrSet#join(Delta)}
 * accepts either.
 */
public record Delta<E>(Map<E, Set<Dot>> adds, Map<E, Set<Dot>> removes) {

    public Delta {
        adds = freeze(adds);
        removes = freeze(removes);
    }

    private static <E> Map<E, Set<Dot>> freeze(final Map<E, Set<Dot>> in) {
        final Map<E, Set<Dot>> out = new HashMap<>(in.size() * 2);
        in.forEach((element, dots) -> {
            if (!dots.isEmpty()) out.put(element, Set.copyOf(dots));
        });
        return Map.copyOf(out);
    }
}
