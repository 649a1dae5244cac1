package io.ringcluster.transport.type;

/**
 * Readiness events delivered by the reactor. Socket events carry the opaque connection id the
 * transport assigned; timer events carry none.
 */
public interface Notification {

    /** A peer connected to our listener. */
    record Accepted(long id) implements Notification {
    }

    /** An outgoing connection finished connecting and is writable. */
    record Connected(long id) implements Notification {
    }

    /** One complete length-delimited frame read from the connection. */
    record Frame(long id, byte[] bytes) implements Notification {
    }

    /** The connection is gone: closed by the peer, failed to connect, or failed I/O. */
    record Closed(long id, Throwable cause) implements Notification {
    }

    /** Coarse tick: liveness expiry, pings and reconciliation. */
    record Tick() implements Notification {
    }

    /** Fine tick forwarded to the executor for process timers. */
    record ExecutorTick() implements Notification {
    }
}
