package io.ringcluster.transport.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import io.ringcluster.api.ClusterApi;
import io.ringcluster.cluster.membership.crdt.Delta;
import io.ringcluster.cluster.membership.crdt.Dot;
import io.ringcluster.core.model.ClusterStatus;
import io.ringcluster.core.model.CorrelationId;
import io.ringcluster.core.model.Envelope;
import io.ringcluster.core.model.Msg;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.core.model.Pid;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps {@link PeerMsg} frames to and from the {@code ClusterServerMsg} protobuf schema.
 * <p>
 * Decoding is total: anything that is not a well-formed frame, including a frame with no variant
 * set or an address without its node, is reported as {@link InvalidProtocolBufferException}.
 */
public final class PeerCodec {

    private static final byte[] PING = ClusterApi.ClusterServerMsg.newBuilder()
            .setPing(ClusterApi.Ping.getDefaultInstance())
            .build()
            .toByteArray();

    public byte[] encode(final PeerMsg msg) {
        if (msg instanceof PeerMsg.Ping) {
            return PING.clone();
        }
        return toProto(msg).toByteArray();
    }

    public PeerMsg decode(final byte[] frame) throws InvalidProtocolBufferException {
        final ClusterApi.ClusterServerMsg pb = ClusterApi.ClusterServerMsg.parseFrom(frame);
        return fromProto(pb);
    }

    /* ---------- frames ---------- */

    static ClusterApi.ClusterServerMsg toProto(final PeerMsg msg) {
        final ClusterApi.ClusterServerMsg.Builder b = ClusterApi.ClusterServerMsg.newBuilder();
        if (msg instanceof PeerMsg.Members m) {
            b.setMembers(ClusterApi.MemberSnapshot.newBuilder()
                    .setFrom(toProto(m.from()))
                    .setState(toProto(m.state())));
        } else if (msg instanceof PeerMsg.Ping) {
            b.setPing(ClusterApi.Ping.getDefaultInstance());
        } else if (msg instanceof PeerMsg.EnvelopeMsg e) {
            b.setEnvelope(toProto(e.envelope()));
        } else if (msg instanceof PeerMsg.DeltaMsg d) {
            b.setDelta(toProto(d.delta()));
        } else {
            throw new IllegalArgumentException("Unknown peer message " + msg);
        }
        return b.build();
    }

    static PeerMsg fromProto(final ClusterApi.ClusterServerMsg pb) throws InvalidProtocolBufferException {
        switch (pb.getMsgCase()) {
            case MEMBERS -> {
                final ClusterApi.MemberSnapshot s = pb.getMembers();
                if (!s.hasFrom()) throw new InvalidProtocolBufferException("members frame without sender");
                return new PeerMsg.Members(fromProto(s.getFrom()), fromProto(s.getState()));
            }
            case PING -> {
                return new PeerMsg.Ping();
            }
            case ENVELOPE -> {
                return new PeerMsg.EnvelopeMsg(fromProto(pb.getEnvelope()));
            }
            case DELTA -> {
                return new PeerMsg.DeltaMsg(fromProto(pb.getDelta()));
            }
            default -> throw new InvalidProtocolBufferException("frame has no message set");
        }
    }

    /* ---------- identities ---------- */

    public static ClusterApi.NodeId toProto(final NodeId node) {
        return ClusterApi.NodeId.newBuilder()
                .setName(node.name())
                .setAddr(node.addr())
                .build();
    }

    public static NodeId fromProto(final ClusterApi.NodeId pb) throws InvalidProtocolBufferException {
        if (pb.getName().isEmpty() || pb.getAddr().isEmpty()) {
            throw new InvalidProtocolBufferException("node id needs both name and addr");
        }
        return new NodeId(pb.getName(), pb.getAddr());
    }

    static ClusterApi.Pid toProto(final Pid pid) {
        final ClusterApi.Pid.Builder b = ClusterApi.Pid.newBuilder()
                .setName(pid.name())
                .setNode(toProto(pid.node()));
        if (pid.group() != null) b.setGroup(pid.group());
        return b.build();
    }

    static Pid fromProto(final ClusterApi.Pid pb) throws InvalidProtocolBufferException {
        if (!pb.hasNode()) throw new InvalidProtocolBufferException("pid without node");
        return new Pid(pb.getName(), pb.hasGroup() ? pb.getGroup() : null, fromProto(pb.getNode()));
    }

    static ClusterApi.CorrelationId toProto(final CorrelationId cid) {
        final ClusterApi.CorrelationId.Builder b = ClusterApi.CorrelationId.newBuilder();
        if (cid.pid() != null) b.setPid(toProto(cid.pid()));
        if (cid.handle() != null) b.setHandle(cid.handle());
        if (cid.request() != null) b.setRequest(cid.request());
        return b.build();
    }

    static CorrelationId fromProto(final ClusterApi.CorrelationId pb) throws InvalidProtocolBufferException {
        return new CorrelationId(
                pb.hasPid() ? fromProto(pb.getPid()) : null,
                pb.hasHandle() ? pb.getHandle() : null,
                pb.hasRequest() ? pb.getRequest() : null);
    }

    /* ---------- envelopes ---------- */

    static ClusterApi.Envelope toProto(final Envelope env) {
        final ClusterApi.Envelope.Builder b = ClusterApi.Envelope.newBuilder()
                .setTo(toProto(env.to()))
                .setFrom(toProto(env.from()))
                .setMsg(toProto(env.body()));
        if (env.correlationId() != null) b.setCid(toProto(env.correlationId()));
        return b.build();
    }

    static Envelope fromProto(final ClusterApi.Envelope pb) throws InvalidProtocolBufferException {
        if (!pb.hasTo() || !pb.hasFrom()) {
            throw new InvalidProtocolBufferException("envelope without sender or recipient");
        }
        return new Envelope(
                fromProto(pb.getTo()),
                fromProto(pb.getFrom()),
                pb.hasCid() ? fromProto(pb.getCid()) : null,
                pb.hasMsg() ? fromProto(pb.getMsg()) : new Msg.Unknown());
    }

    static ClusterApi.PbMsg toProto(final Msg msg) {
        final ClusterApi.PbMsg.Builder b = ClusterApi.PbMsg.newBuilder();
        if (msg instanceof Msg.User u) {
            b.setUserMsg(ByteString.copyFrom(u.payload()));
        } else if (msg instanceof Msg.GetMetrics) {
            b.setGetMetrics(ClusterApi.GetMetrics.getDefaultInstance());
        } else if (msg instanceof Msg.Metrics m) {
            final ClusterApi.Metrics.Builder mb = ClusterApi.Metrics.newBuilder();
            new TreeMap<>(m.values()).forEach((name, value) -> mb.addMetrics(
                    ClusterApi.Metric.newBuilder().setName(name).setValue(value)));
            b.setMetrics(mb);
        } else if (msg instanceof Msg.Status s) {
            final ClusterStatus status = s.status();
            final ClusterApi.ClusterStatus.Builder sb = ClusterApi.ClusterStatus.newBuilder()
                    .setNumConnections(status.numConnections());
            status.members().stream().sorted().forEach(n -> sb.addMembers(toProto(n)));
            status.established().stream().sorted().forEach(n -> sb.addEstablished(toProto(n)));
            b.setClusterStatus(sb);
        }
        return b.build();
    }

    static Msg fromProto(final ClusterApi.PbMsg pb) throws InvalidProtocolBufferException {
        switch (pb.getKindCase()) {
            case USER_MSG -> {
                return new Msg.User(pb.getUserMsg().toByteArray());
            }
            case GET_METRICS -> {
                return new Msg.GetMetrics();
            }
            case METRICS -> {
                final Map<String, Long> values = new LinkedHashMap<>();
                for (final ClusterApi.Metric m : pb.getMetrics().getMetricsList()) {
                    values.put(m.getName(), m.getValue());
                }
                return new Msg.Metrics(values);
            }
            case CLUSTER_STATUS -> {
                final ClusterApi.ClusterStatus s = pb.getClusterStatus();
                return new Msg.Status(new ClusterStatus(
                        fromProto(s.getMembersList()),
                        fromProto(s.getEstablishedList()),
                        s.getNumConnections()));
            }
            default -> {
                return new Msg.Unknown();
            }
        }
    }

    private static Set<NodeId> fromProto(final List<ClusterApi.NodeId> nodes) throws InvalidProtocolBufferException {
        final Set<NodeId> out = new HashSet<>();
        for (final ClusterApi.NodeId n : nodes) {
            out.add(fromProto(n));
        }
        return out;
    }

    /* ---------- membership ---------- */

    static ClusterApi.MemberDelta toProto(final Delta<NodeId> delta) {
        final ClusterApi.MemberDelta.Builder b = ClusterApi.MemberDelta.newBuilder();
        delta.adds().forEach((node, dots) -> b.addAdds(toProto(node, dots)));
        delta.removes().forEach((node, dots) -> b.addRemoves(toProto(node, dots)));
        return b.build();
    }

    static Delta<NodeId> fromProto(final ClusterApi.MemberDelta pb) throws InvalidProtocolBufferException {
        return new Delta<>(fromProto(pb.getAddsList(), "adds"), fromProto(pb.getRemovesList(), "removes"));
    }

    private static ClusterApi.ElementDots toProto(final NodeId node, final Set<Dot> dots) {
        final ClusterApi.ElementDots.Builder b = ClusterApi.ElementDots.newBuilder().setElement(toProto(node));
        for (final Dot d : dots) {
            b.addDots(ClusterApi.Dot.newBuilder().setOrigin(d.origin()).setCounter(d.counter()));
        }
        return b.build();
    }

    private static Map<NodeId, Set<Dot>> fromProto(final List<ClusterApi.ElementDots> entries,
                                                    final String field) throws InvalidProtocolBufferException {
        final Map<NodeId, Set<Dot>> out = new HashMap<>();
        for (final ClusterApi.ElementDots e : entries) {
            if (!e.hasElement()) throw new InvalidProtocolBufferException(field + " entry without element");
            final Set<Dot> dots = out.computeIfAbsent(fromProto(e.getElement()), k -> new HashSet<>());
            for (final ClusterApi.Dot d : e.getDotsList()) {
                if (d.getOrigin().isEmpty() || d.getCounter() <= 0) {
                    throw new InvalidProtocolBufferException(field + " entry with invalid dot");
                }
                dots.add(new Dot(d.getOrigin(), d.getCounter()));
            }
        }
        return out;
    }
}
