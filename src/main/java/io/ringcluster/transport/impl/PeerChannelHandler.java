package io.ringcluster.transport.impl;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.ringcluster.transport.type.Notification;
import io.ringcluster.transport.type.NotificationSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns channel events of one peer connection into {@link Notification}s. Frames decoded during one
 * read cycle are delivered together when the cycle completes.
 */
@Slf4j
final class PeerChannelHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private final long id;
    private final boolean initiator;
    private final NotificationSink sink;
    private final ConcurrentMap<Long, Channel> channels;

    /* only touched from this channel's event loop */
    private List<Notification> pending = new ArrayList<>();

    PeerChannelHandler(final long id,
                       final boolean initiator,
                       final NotificationSink sink,
                       final ConcurrentMap<Long, Channel> channels) {
        this.id = id;
        this.initiator = initiator;
        this.sink = sink;
        this.channels = channels;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.debug("Channel {} active (initiator={}) {}", id, initiator, ctx.channel().remoteAddress());
        pending.add(initiator ? new Notification.Connected(id) : new Notification.Accepted(id));
        flush();
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final ByteBuf frame) {
        pending.add(new Notification.Frame(id, ByteBufUtil.getBytes(frame)));
    }

    @Override
    public void channelReadComplete(final ChannelHandlerContext ctx) throws Exception {
        flush();
        super.channelReadComplete(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        channels.remove(id, ctx.channel());
        pending.add(new Notification.Closed(id, null));
        flush();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.debug("Channel {} error: {}", id, cause.toString());
        channels.remove(id, ctx.channel());
        pending.add(new Notification.Closed(id, cause));
        flush();
        ctx.close();
    }

    private void flush() {
        if (pending.isEmpty()) return;
        final List<Notification> batch = pending;
        pending = new ArrayList<>();
        sink.deliver(batch);
    }
}
