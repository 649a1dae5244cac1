package io.ringcluster.core.model;

/**
 * Opaque request/response correlator. Any field may be absent; the issuer of the original request
 * decides which ones it needs.
 */
public record CorrelationId(Pid pid, Long handle, Long request) {

    public static CorrelationId pid(final Pid pid) {
        return new CorrelationId(pid, null, null);
    }

    public static CorrelationId request(final Pid pid, final long handle, final long request) {
        return new CorrelationId(pid, handle, request);
    }
}
