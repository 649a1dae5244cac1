package io.ringcluster.transport.impl;

import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.transport.type.Notification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class NettyPeerTransportTest {

    private static final int MAX_FRAME = 1024;

    private final LinkedBlockingQueue<Notification> serverEvents = new LinkedBlockingQueue<>();
    private final LinkedBlockingQueue<Notification> clientEvents = new LinkedBlockingQueue<>();

    private NettyPeerTransport server;
    private NettyPeerTransport client;
    private NodeId serverId;

    @BeforeEach
    void start() throws Exception {
        server = new NettyPeerTransport(new InetSocketAddress("127.0.0.1", 0), MAX_FRAME);
        server.start(serverEvents::addAll);
        serverId = new NodeId("server", "127.0.0.1:" + server.getPort());

        client = new NettyPeerTransport(new InetSocketAddress("127.0.0.1", 0), MAX_FRAME);
        client.start(clientEvents::addAll);
    }

    @AfterEach
    void stop() {
        client.close();
        server.close();
    }

    @Test
    void framesArriveWholeInBothDirections() throws Exception {
        final long out = client.connect(serverId);
        assertEquals(new Notification.Connected(out), next(clientEvents));
        final Notification.Accepted accepted = assertInstanceOf(Notification.Accepted.class, next(serverEvents));

        client.write(out, bytes("first"));
        client.write(out, bytes("second"));
        assertArrayEquals(bytes("first"), frame(serverEvents, accepted.id()));
        assertArrayEquals(bytes("second"), frame(serverEvents, accepted.id()));

        server.write(accepted.id(), bytes("reply"));
        assertArrayEquals(bytes("reply"), frame(clientEvents, out));
    }

    @Test
    void deregisterClosesThePeerSide() throws Exception {
        final long out = client.connect(serverId);
        next(clientEvents);
        final Notification.Accepted accepted = assertInstanceOf(Notification.Accepted.class, next(serverEvents));

        client.deregister(out);

        final Notification.Closed closed = assertInstanceOf(Notification.Closed.class, next(serverEvents));
        assertEquals(accepted.id(), closed.id());
        assertThrows(ClusterException.class, () -> client.write(out, bytes("late")));
    }

    @Test
    void frameOfExactlyMaxSizeIsDelivered() throws Exception {
        final long out = client.connect(serverId);
        next(clientEvents);
        final Notification.Accepted accepted = assertInstanceOf(Notification.Accepted.class, next(serverEvents));

        final byte[] payload = new byte[MAX_FRAME];
        payload[MAX_FRAME - 1] = 7;
        client.write(out, payload);

        assertArrayEquals(payload, frame(serverEvents, accepted.id()));
    }

    @Test
    void oversizedFrameClosesTheConnection() throws Exception {
        final long out = client.connect(serverId);
        next(clientEvents);
        final Notification.Accepted accepted = assertInstanceOf(Notification.Accepted.class, next(serverEvents));

        client.write(out, new byte[MAX_FRAME + 1]);

        final Notification.Closed closed = assertInstanceOf(Notification.Closed.class, next(serverEvents));
        assertEquals(accepted.id(), closed.id());
    }

    @Test
    void refusedConnectIsReportedAsClosed() throws Exception {
        final int port = server.getPort();
        server.close();

        final long out = client.connect(new NodeId("gone", "127.0.0.1:" + port));

        final Notification.Closed closed = assertInstanceOf(Notification.Closed.class, next(clientEvents));
        assertEquals(out, closed.id());
        assertNotNull(closed.cause());
    }

    @Test
    void writeToUnknownConnectionFails() {
        final ClusterException e = assertThrows(ClusterException.class, () -> client.write(42L, bytes("x")));
        assertEquals(ClusterException.Kind.WRITE, e.getKind());
        assertEquals(List.of(42L), e.getIds());
    }

    private static Notification next(final LinkedBlockingQueue<Notification> events) throws InterruptedException {
        final Notification n = events.poll(5, TimeUnit.SECONDS);
        assertNotNull(n, "no notification within 5s");
        return n;
    }

    private static byte[] frame(final LinkedBlockingQueue<Notification> events, final long id) throws InterruptedException {
        final Notification.Frame f = assertInstanceOf(Notification.Frame.class, next(events));
        assertEquals(id, f.id());
        return f.bytes();
    }

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
