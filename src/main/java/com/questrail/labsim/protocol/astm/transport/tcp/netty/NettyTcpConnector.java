package com.questrail.labsim.protocol.astm.transport.tcp.netty;

import com.questrail.labsim.protocol.astm.transport.LinkConnection;
import com.questrail.labsim.protocol.astm.transport.LinkConnector;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.AttributeKey;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyTcpConnector
 * =============================================================================
 * Netty-backed implementation of the {@link LinkConnector} port. One event loop
 * group serves every outbound connection made through this connector.
 */
public final class NettyTcpConnector implements LinkConnector
{
    private static final AttributeKey<NettyLinkConnection> CONNECTION_KEY =
            AttributeKey.valueOf("astmLinkConnection");

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    public NettyTcpConnector(Duration connectTimeout)
    {
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyLinkConnection connection = new NettyLinkConnection(ch);
                        ch.attr(CONNECTION_KEY).set(connection);
                        ch.pipeline().addLast(connection.inboundHandler());
                    }
                });
    }

    @Override
    public LinkConnection connect(InetSocketAddress remote) throws IOException
    {
        Objects.requireNonNull(remote, "remote");

        ChannelFuture f = bootstrap.connect(remote).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IOException("Cannot connect to " + remote, f.cause());
        }
        return f.channel().attr(CONNECTION_KEY).get();
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }
}
