package com.questrail.labsim.protocol.astm.runtime;

import com.questrail.labsim.protocol.astm.AstmLinkSession;
import com.questrail.labsim.protocol.astm.MessageGenerator;
import com.questrail.labsim.protocol.astm.ReceivedMessageSink;
import com.questrail.labsim.protocol.astm.internal.exec.AstmTimingPolicy;
import com.questrail.labsim.protocol.astm.internal.time.SystemWallClock;
import com.questrail.labsim.protocol.astm.internal.time.WallClock;
import com.questrail.labsim.protocol.astm.observability.AstmObservabilitySink;
import com.questrail.labsim.protocol.astm.observability.AstmTransportEvent;
import com.questrail.labsim.protocol.astm.transport.LinkConnection;
import com.questrail.labsim.protocol.astm.transport.LinkServerListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AstmConnectionManager
 * =============================================================================
 * Turns accepted connections into independent {@link AstmLinkSession}s.
 *
 * <h2>Threading</h2>
 * Each session runs on its own thread from a cached pool; sessions share no
 * mutable protocol state. {@link #onConnection(LinkConnection)} is called on a
 * transport thread and only registers and hands off.
 *
 * <h2>Capacity</h2>
 * At most {@code maxSessions} sessions run at once. A connection accepted
 * beyond that is closed immediately and reported as
 * {@link AstmTransportEvent.Kind#REJECTED_AT_CAPACITY}.
 */
public final class AstmConnectionManager implements LinkServerListener
{
    private static final Logger log = LoggerFactory.getLogger(AstmConnectionManager.class);

    private final int maxSessions;
    private final AstmTimingPolicy timingPolicy;
    private final boolean acceptsInbound;
    private final boolean proactive;
    private final MessageGenerator generator;
    private final String templateId;
    private final ReceivedMessageSink messageSink;
    private final AstmObservabilitySink observability;
    private final WallClock wallClock;

    private final ExecutorService sessionExecutor;
    private final Map<String, LinkConnection> active = new ConcurrentHashMap<>();
    private final AtomicLong sessionCounter = new AtomicLong();

    private volatile boolean stopped;

    public AstmConnectionManager(int maxSessions,
                                 AstmTimingPolicy timingPolicy,
                                 boolean acceptsInbound,
                                 boolean proactive,
                                 MessageGenerator generator,
                                 String templateId,
                                 ReceivedMessageSink messageSink,
                                 AstmObservabilitySink observability)
    {
        this(maxSessions, timingPolicy, acceptsInbound, proactive, generator, templateId,
                messageSink, observability, SystemWallClock.INSTANCE);
    }

    public AstmConnectionManager(int maxSessions,
                                 AstmTimingPolicy timingPolicy,
                                 boolean acceptsInbound,
                                 boolean proactive,
                                 MessageGenerator generator,
                                 String templateId,
                                 ReceivedMessageSink messageSink,
                                 AstmObservabilitySink observability,
                                 WallClock wallClock)
    {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1");
        }
        this.maxSessions = maxSessions;
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.acceptsInbound = acceptsInbound;
        this.proactive = proactive;
        this.generator = Objects.requireNonNull(generator, "generator");
        this.templateId = Objects.requireNonNull(templateId, "templateId");
        this.messageSink = Objects.requireNonNull(messageSink, "messageSink");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        AtomicLong threadCounter = new AtomicLong();
        this.sessionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "astm-session-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void onConnection(LinkConnection connection)
    {
        Objects.requireNonNull(connection, "connection");
        final String sessionId = "astm-" + sessionCounter.incrementAndGet();

        synchronized (active) {
            if (stopped) {
                connection.close();
                return;
            }
            if (active.size() >= maxSessions) {
                connection.close();
                observability.onTransportEvent(new AstmTransportEvent(
                        wallClock.now(), sessionId, AstmTransportEvent.Kind.REJECTED_AT_CAPACITY,
                        connection.remoteAddress()));
                return;
            }
            active.put(sessionId, connection);
        }

        AstmLinkSession.Builder builder = AstmLinkSession.builder()
                .withSessionId(sessionId)
                .withConnection(connection)
                .withTimingPolicy(timingPolicy)
                .withAcceptsInbound(acceptsInbound)
                .withMessageGenerator(generator, templateId)
                .withMessageSink(messageSink)
                .withObservabilitySink(observability)
                .withWallClock(wallClock);
        if (proactive) {
            builder.withProactiveMessage(() -> generator.generate(templateId, null));
        }
        AstmLinkSession session = builder.build();

        sessionExecutor.execute(() -> {
            try {
                session.run();
            } finally {
                active.remove(sessionId);
            }
        });
    }

    /** Number of sessions currently holding a connection. */
    public int activeSessionCount()
    {
        return active.size();
    }

    public List<String> activeSessionIds()
    {
        return new ArrayList<>(active.keySet());
    }

    /**
     * Refuses new connections, closes every open one and waits for the session
     * threads to finish.
     */
    public void stop()
    {
        synchronized (active) {
            stopped = true;
        }
        active.values().forEach(LinkConnection::close);

        sessionExecutor.shutdown();
        try {
            if (!sessionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sessions still running after 5s, interrupting");
                sessionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sessionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
