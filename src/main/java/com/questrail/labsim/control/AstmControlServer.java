package com.questrail.labsim.control;

import com.questrail.labsim.protocol.astm.runtime.AstmPushService;
import com.questrail.labsim.template.TemplateCatalog;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * AstmControlServer
 * =============================================================================
 * Small HTTP surface for operating the simulator remotely.
 *
 * <ul>
 *   <li>{@code GET /health}, {@code GET /}: status, active sessions, templates</li>
 *   <li>{@code POST /push?analyzer_type=&count=}: push generated results to the
 *       bridge; a JSON body with the same names overrides the query</li>
 * </ul>
 *
 * Responses are JSON. One request per connection.
 */
public final class AstmControlServer
{
    private static final Logger log = LoggerFactory.getLogger(AstmControlServer.class);

    private static final int MAX_CONTENT_LENGTH = 64 * 1024;

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ExecutorService pushExecutor;
    private final ServerBootstrap bootstrap;

    private volatile Channel serverChannel;

    /**
     * @param pushService push service, or {@code null} when no push target is
     *                    configured ({@code /push} then answers 503)
     */
    public AstmControlServer(InetSocketAddress bindAddress,
                             TemplateCatalog catalog,
                             String defaultTemplate,
                             IntSupplier activeSessions,
                             AstmPushService pushService)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(defaultTemplate, "defaultTemplate");
        Objects.requireNonNull(activeSessions, "activeSessions");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.pushExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "astm-http-push");
            t.setDaemon(true);
            return t;
        });
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                                .addLast(new ControlRequestHandler(
                                        catalog, defaultTemplate, activeSessions, pushService, pushExecutor));
                    }
                });
    }

    /**
     * Binds synchronously.
     *
     * @throws IllegalStateException if binding fails
     */
    public void start()
    {
        ChannelFuture f = bootstrap.bind(bindAddress).syncUninterruptibly();
        if (!f.isSuccess()) {
            throw new IllegalStateException("Failed to bind control server to " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        log.info("Control API listening on {}", serverChannel.localAddress());
    }

    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        pushExecutor.shutdownNow();
        try {
            pushExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Control server not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }
}
