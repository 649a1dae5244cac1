package io.ringcluster.transport.impl;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.IoHandlerFactory;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.ringcluster.core.error.ClusterException;
import io.ringcluster.core.model.NodeId;
import io.ringcluster.transport.type.Notification;
import io.ringcluster.transport.type.NotificationSink;
import io.ringcluster.transport.type.PeerTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Netty reactor for peer connections: one boss thread accepting, one worker thread doing all socket
 * I/O. Frames are length-prefixed (4 bytes, big-endian) and capped at {@code maxFrameBytes}.
 * <p>
 * Writes are handed to the channel's outbound buffer and flushed as the socket becomes writable, so
 * the caller never blocks on a slow peer.
 */
@Slf4j
public final class NettyPeerTransport implements PeerTransport {

    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    private final InetSocketAddress bind;
    private final int maxFrameBytes;

    private final AtomicLong ids = new AtomicLong(1L);
    private final ConcurrentMap<Long, Channel> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Bootstrap clientBootstrap;
    private Channel serverChannel;
    private volatile NotificationSink sink;

    @Getter
    private int port;

    public NettyPeerTransport(final InetSocketAddress bind, final int maxFrameBytes) {
        this.bind = bind;
        this.maxFrameBytes = maxFrameBytes;
        this.port = bind.getPort();
    }

    @Override
    public void start(final NotificationSink sink) throws InterruptedException {
        this.sink = sink;
        final IoHandlerFactory factory = NioIoHandler.newFactory();

        /*
         * Netty Threading Model:
         * 1 Boss thread for accepting connections.
         * 1 Worker thread for all peer socket I/O, outgoing connections included.
         */
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(1, factory);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final long id = ids.getAndIncrement();
                        channels.put(id, ch);
                        configure(ch.pipeline(), id, false);
                    }
                })
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        clientBootstrap = new Bootstrap()
                .group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        final ChannelFuture f = b.bind(bind).sync();
        serverChannel = f.channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Cluster transport listening on {}:{}", bind.getHostString(), port);
    }

    private void configure(final ChannelPipeline p, final long id, final boolean initiator) {
        /* Framing (4 byte length prefix); the decoder bound includes the prefix itself */
        final int maxWireFrame = (int) Math.min(Integer.MAX_VALUE, (long) maxFrameBytes + 4);
        p.addLast(new LengthFieldBasedFrameDecoder(maxWireFrame, 0, 4, 0, 4));
        p.addLast(new LengthFieldPrepender(4));
        p.addLast(new PeerChannelHandler(id, initiator, sink, channels));
    }

    @Override
    public long connect(final NodeId peer) throws ClusterException {
        if (clientBootstrap == null || closed.get()) {
            throw ClusterException.connect(peer, new IllegalStateException("transport not running"));
        }

        final InetSocketAddress remote;
        try {
            remote = new InetSocketAddress(peer.host(), peer.port());
        } catch (final RuntimeException e) {
            throw ClusterException.connect(peer, e);
        }

        final long id = ids.getAndIncrement();
        final ChannelFuture f = clientBootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        configure(ch.pipeline(), id, true);
                    }
                })
                .connect(remote);

        channels.put(id, f.channel());
        f.addListener(cf -> {
            if (!cf.isSuccess()) {
                log.debug("Connect {} to {} failed: {}", id, peer, cf.cause().toString());
                channels.remove(id);
                sink.deliver(List.of(new Notification.Closed(id, cf.cause())));
            }
        });
        return id;
    }

    @Override
    public void write(final long id, final byte[] frame) throws ClusterException {
        final Channel ch = channels.get(id);
        if (ch == null || !ch.isActive()) {
            throw ClusterException.write(id, null, new ClosedChannelException());
        }
        ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("Write to {} failed: {}", id, f.cause().toString());
                sink.deliver(List.of(new Notification.Closed(id, f.cause())));
            }
        });
    }

    @Override
    public void deregister(final long id) {
        final Channel ch = channels.remove(id);
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        channels.values().forEach(Channel::close);
        channels.clear();
        try {
            if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        } finally {
            if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        log.info("Cluster transport on port {} closed", port);
    }
}
