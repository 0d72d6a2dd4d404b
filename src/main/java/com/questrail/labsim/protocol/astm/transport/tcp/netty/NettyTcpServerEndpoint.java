package com.questrail.labsim.protocol.astm.transport.tcp.netty;

import com.questrail.labsim.protocol.astm.transport.LinkServerEndpoint;
import com.questrail.labsim.protocol.astm.transport.LinkServerListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyTcpServerEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link LinkServerEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * Pure transport adapter: accepts TCP connections and wraps each one in a
 * {@link NettyLinkConnection}. It does not read frames, acknowledge anything or
 * enforce protocol timeouts.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously so callers can read {@link #localAddress()}.
 * - {@link #stop()} closes the listening channel and shuts down both event loop groups.
 */
public final class NettyTcpServerEndpoint implements LinkServerEndpoint
{
    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile LinkServerListener listener;
    private volatile Channel serverChannel;

    public NettyTcpServerEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyLinkConnection connection = new NettyLinkConnection(ch);
                        ch.pipeline().addLast(connection.inboundHandler());
                        ch.pipeline().addFirst(new AcceptNotifier(connection));
                    }
                });
    }

    @Override
    public void setListener(LinkServerListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("LinkServerListener must be set before start()");
        }

        ChannelFuture f = bootstrap.bind(bindAddress).syncUninterruptibly();
        if (!f.isSuccess()) {
            throw new IllegalStateException("Failed to bind " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Endpoint not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    /**
     * Announces an accepted connection once the channel is active, then passes
     * every event through unchanged.
     */
    private final class AcceptNotifier extends ChannelInboundHandlerAdapter
    {
        private final NettyLinkConnection connection;

        AcceptNotifier(NettyLinkConnection connection)
        {
            this.connection = connection;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            LinkServerListener l = listener;
            if (l != null) {
                l.onConnection(connection);
            }
            super.channelActive(ctx);
        }
    }
}
