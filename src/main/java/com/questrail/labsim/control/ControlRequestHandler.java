package com.questrail.labsim.control;

import com.questrail.labsim.protocol.astm.runtime.AstmPushService;
import com.questrail.labsim.protocol.astm.runtime.PushReport;
import com.questrail.labsim.template.TemplateCatalog;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntSupplier;

/**
 * Routes control requests. Pushes block for the whole exchange, so they run on
 * the push executor and answer from there; everything else answers on the
 * event loop.
 */
final class ControlRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest>
{
    private static final Logger log = LoggerFactory.getLogger(ControlRequestHandler.class);

    static final String SERVICE_NAME = "ASTM Analyzer Simulator";

    private final TemplateCatalog catalog;
    private final String defaultTemplate;
    private final IntSupplier activeSessions;
    private final AstmPushService pushService;
    private final ExecutorService pushExecutor;

    ControlRequestHandler(TemplateCatalog catalog,
                          String defaultTemplate,
                          IntSupplier activeSessions,
                          AstmPushService pushService,
                          ExecutorService pushExecutor)
    {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.defaultTemplate = Objects.requireNonNull(defaultTemplate, "defaultTemplate");
        this.activeSessions = Objects.requireNonNull(activeSessions, "activeSessions");
        this.pushService = pushService;
        this.pushExecutor = Objects.requireNonNull(pushExecutor, "pushExecutor");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        QueryStringDecoder uri = new QueryStringDecoder(request.uri());
        String path = uri.path();
        HttpMethod method = request.method();
        log.debug("{} {} from {}", method, request.uri(), ctx.channel().remoteAddress());

        if (HttpMethod.GET.equals(method) && ("/health".equals(path) || "/".equals(path))) {
            respond(ctx, HttpResponseStatus.OK, ControlJson.health(
                    SERVICE_NAME, activeSessions.getAsInt(), catalog.ids(), pushService != null));
            return;
        }
        if (HttpMethod.POST.equals(method) && "/push".equals(path)) {
            handlePush(ctx, uri.parameters(), ByteBufUtil.getBytes(request.content()));
            return;
        }
        respond(ctx, HttpResponseStatus.NOT_FOUND, ControlJson.error("Not Found: " + method + " " + path));
    }

    private void handlePush(ChannelHandlerContext ctx, Map<String, List<String>> query, byte[] body)
    {
        if (pushService == null) {
            respond(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE,
                    ControlJson.error("Push target not configured"));
            return;
        }

        final String templateId;
        final int count;
        try {
            Map<String, String> overrides = ControlJson.parseFlatObject(body);
            templateId = overrides.getOrDefault("analyzer_type", first(query, "analyzer_type", defaultTemplate));
            count = parseCount(overrides.getOrDefault("count", first(query, "count", "1")));
            if (!catalog.contains(templateId)) {
                throw new IllegalArgumentException("Unknown analyzer_type: " + templateId);
            }
        } catch (IllegalArgumentException e) {
            respond(ctx, HttpResponseStatus.BAD_REQUEST, ControlJson.error(e.getMessage()));
            return;
        }

        log.info("Push request from {}: analyzer_type={}, count={}", ctx.channel().remoteAddress(), templateId, count);
        try {
            pushExecutor.execute(() -> runPush(ctx, templateId, count));
        } catch (RejectedExecutionException e) {
            respond(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, ControlJson.error("Shutting down"));
        }
    }

    private void runPush(ChannelHandlerContext ctx, String templateId, int count)
    {
        try {
            PushReport report = pushService.pushBatch(templateId, count, Duration.ZERO);
            log.info("Push request completed: {}/{} successful", report.successful(), report.total());
            respond(ctx, HttpResponseStatus.OK, ControlJson.pushReport(report, templateId));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            respond(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, ControlJson.error("Interrupted"));
        } catch (RuntimeException e) {
            log.error("Push request failed", e);
            respond(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR, ControlJson.error(String.valueOf(e.getMessage())));
        }
    }

    private static String first(Map<String, List<String>> query, String name, String fallback)
    {
        List<String> values = query.get(name);
        return values == null || values.isEmpty() ? fallback : values.get(0);
    }

    private static int parseCount(String value)
    {
        final int count;
        try {
            count = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("count must be an integer: " + value, e);
        }
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        return count;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.warn("Control connection {} failed: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    private static void respond(ChannelHandlerContext ctx, HttpResponseStatus status, byte[] json)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(json));
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, json.length)
                .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
