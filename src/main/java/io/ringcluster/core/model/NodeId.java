package io.ringcluster.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a cluster node: a logical name plus the {@code host:port} its cluster listener binds.
 * <p>
 * Ordering is lexicographic on name, then address. Every node evaluates the same ordering, which is
 * what lets both ends of a duplicated link agree on which connection survives.
 */
public record NodeId(String name, String addr) implements Comparable<NodeId> {

    private static final Comparator<NodeId> ORDER =
            Comparator.comparing(NodeId::name).thenComparing(NodeId::addr);

    public NodeId {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(addr, "addr");
    }

    /**
     * Parses the {@code name@host:port} form produced by {@link #toString()}.
     */
    public static NodeId parse(final String s) {
        final String[] parts = s.split("@", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new IllegalArgumentException("Invalid NodeId '" + s + "' - must be of form 'name@addr'");
        }
        return new NodeId(parts[0], parts[1]);
    }

    public String host() {
        final int idx = addr.lastIndexOf(':');
        return idx < 0 ? addr : addr.substring(0, idx);
    }

    public int port() {
        final int idx = addr.lastIndexOf(':');
        if (idx < 0) throw new IllegalStateException("No port in address " + addr);
        return Integer.parseInt(addr.substring(idx + 1));
    }

    @Override
    public int compareTo(final NodeId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return name + "@" + addr;
    }
}
