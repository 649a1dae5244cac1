package io.ringcluster.core.error;

import io.ringcluster.core.model.NodeId;
import io.ringcluster.core.model.Pid;
import lombok.Getter;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Failure raised inside the cluster server, attributed to the connections it concerns so that the
 * caller can close exactly those and carry on.
 */
@Getter
public final class ClusterException extends Exception {

    public enum Kind {
        ENCODE,
        DECODE,
        WRITE,
        CONNECT,
        /** The executor no longer accepts messages. Fatal. */
        SEND,
        /** Deliberate stop, not an error. */
        SHUTDOWN,
        BROADCAST,
        POLL_NOTIFICATIONS
    }

    private final Kind kind;
    private final List<Long> ids;
    private final NodeId peer;
    private final List<ClusterException> causes;

    private ClusterException(final Kind kind,
                             final String message,
                             final Collection<Long> ids,
                             final NodeId peer,
                             final List<ClusterException> causes,
                             final Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.ids = List.copyOf(ids);
        this.peer = peer;
        this.causes = List.copyOf(causes);
        causes.forEach(this::addSuppressed);
    }

    private static ClusterException of(final Kind kind,
                                       final String message,
                                       final Long id,
                                       final NodeId peer,
                                       final Throwable cause) {
        return new ClusterException(kind, message, id == null ? List.of() : List.of(id), peer, List.of(), cause);
    }

    public static ClusterException encode(final Long id, final NodeId peer, final Throwable cause) {
        return of(Kind.ENCODE, "Failed to encode message for connection " + id + " (peer " + peer + ")", id, peer, cause);
    }

    public static ClusterException decode(final long id, final NodeId peer, final Throwable cause) {
        return of(Kind.DECODE, "Failed to decode frame from connection " + id + " (peer " + peer + ")", id, peer, cause);
    }

    public static ClusterException write(final long id, final NodeId peer, final Throwable cause) {
        return of(Kind.WRITE, "Write failed on connection " + id + " (peer " + peer + ")", id, peer, cause);
    }

    public static ClusterException connect(final NodeId peer, final Throwable cause) {
        return of(Kind.CONNECT, "Failed to connect to " + peer, null, peer, cause);
    }

    public static ClusterException send(final String what, final Pid to) {
        return of(Kind.SEND, "Failed to send " + what + " to executor (to " + to + ")", null, null, null);
    }

    public static ClusterException shutdown(final Pid pid) {
        return of(Kind.SHUTDOWN, "Shutdown requested for " + pid, null, null, null);
    }

    public static ClusterException aggregate(final Kind kind, final List<ClusterException> errors) {
        final StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(errors.size()).append(" error(s)");
        for (final ClusterException e : errors) {
            sb.append("; ").append(e.getMessage());
        }
        return new ClusterException(kind, sb.toString(), List.of(), null, errors, null);
    }

    /** Ids of every connection this error, or any aggregated child, is attributed to. */
    public Set<Long> connectionIds() {
        final Set<Long> out = new LinkedHashSet<>(ids);
        for (final ClusterException c : causes) {
            out.addAll(c.connectionIds());
        }
        return out;
    }

    public boolean isFatal() {
        if (kind == Kind.SEND) return true;
        for (final ClusterException c : causes) {
            if (c.isFatal()) return true;
        }
        return false;
    }

    public boolean isShutdown() {
        return kind == Kind.SHUTDOWN;
    }
}
