package com.questrail.labsim.protocol.astm.transport.tcp.netty;

import com.questrail.labsim.protocol.astm.transport.BlockingByteInbox;
import com.questrail.labsim.protocol.astm.transport.LinkConnection;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyLinkConnection
 * =============================================================================
 * {@link LinkConnection} over a Netty TCP {@link Channel}.
 *
 * <h2>Threading</h2>
 * Netty's event loop copies inbound {@link ByteBuf}s into a
 * {@link BlockingByteInbox}; the session thread drains the inbox with
 * deadline-bounded reads. Writes block the session thread until Netty reports
 * the flush outcome. Session threads are never event-loop threads, so the
 * blocking write cannot deadlock the loop.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package.
 */
public final class NettyLinkConnection implements LinkConnection
{
    private static final long WRITE_TIMEOUT_MILLIS = 15_000;

    private final Channel channel;
    private final BlockingByteInbox inbox = new BlockingByteInbox();

    NettyLinkConnection(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Handler to install as the last stage of the channel pipeline.
     */
    SimpleChannelInboundHandler<ByteBuf> inboundHandler()
    {
        return new InboundHandler();
    }

    @Override
    public int read(Duration timeout) throws InterruptedException
    {
        return inbox.read(timeout);
    }

    @Override
    public void write(byte[] bytes) throws IOException
    {
        Objects.requireNonNull(bytes, "bytes");
        if (!channel.isActive()) {
            throw new IOException("Connection to " + remoteAddress() + " is closed");
        }

        ChannelFuture f = channel.writeAndFlush(Unpooled.copiedBuffer(bytes));
        if (!f.awaitUninterruptibly(WRITE_TIMEOUT_MILLIS)) {
            throw new IOException("Write to " + remoteAddress() + " timed out");
        }
        if (!f.isSuccess()) {
            throw new IOException("Write to " + remoteAddress() + " failed", f.cause());
        }
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive() && !inbox.isClosed();
    }

    @Override
    public String remoteAddress()
    {
        SocketAddress remote = channel.remoteAddress();
        return remote != null ? remote.toString() : "unknown";
    }

    @Override
    public void close()
    {
        inbox.close();
        channel.close();
    }

    /**
     * Copies payload bytes into the inbox (Netty containment rule) and turns
     * channel shutdown into end-of-stream.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            inbox.offer(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            inbox.close();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            inbox.close();
            ctx.close();
        }
    }
}
