package com.questrail.labsim.protocol.astm.runtime;

import com.questrail.labsim.protocol.astm.AstmLinkSession;
import com.questrail.labsim.protocol.astm.ExchangeOutcome;
import com.questrail.labsim.protocol.astm.MessageGenerator;
import com.questrail.labsim.protocol.astm.internal.exec.AstmTimingPolicy;
import com.questrail.labsim.protocol.astm.internal.time.Cancellable;
import com.questrail.labsim.protocol.astm.internal.time.MonotonicClock;
import com.questrail.labsim.protocol.astm.internal.time.MonotonicScheduler;
import com.questrail.labsim.protocol.astm.model.AstmMessage;
import com.questrail.labsim.protocol.astm.observability.AstmObservabilitySink;
import com.questrail.labsim.protocol.astm.transport.LinkConnection;
import com.questrail.labsim.protocol.astm.transport.LinkConnector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AstmPushService
 * =============================================================================
 * Sends generated results to a bridge that listens for analyzers, acting as
 * Initiator on a fresh connection per message.
 *
 * <h2>Modes</h2>
 * <ul>
 *   <li>{@link #pushOnce(String)}: one message, one connection.</li>
 *   <li>{@link #pushBatch(String, int, Duration)}: {@code count} messages on
 *       the calling thread, pausing {@code interval} between them (not after
 *       the last).</li>
 *   <li>{@link #startContinuous(String, Duration)}: one message per interval on
 *       the scheduler until {@link #stopContinuous()}.</li>
 * </ul>
 *
 * Failures never throw; each attempt reports its {@link ExchangeOutcome}.
 */
public final class AstmPushService
{
    private static final Logger log = LoggerFactory.getLogger(AstmPushService.class);

    private final LinkConnector connector;
    private final InetSocketAddress target;
    private final MessageGenerator generator;
    private final AstmTimingPolicy timingPolicy;
    private final AstmObservabilitySink observability;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    private final AtomicLong pushCounter = new AtomicLong();
    private final Object continuousLock = new Object();

    private Cancellable nextRound;
    private boolean continuous;

    public AstmPushService(LinkConnector connector,
                           InetSocketAddress target,
                           MessageGenerator generator,
                           AstmTimingPolicy timingPolicy,
                           AstmObservabilitySink observability,
                           MonotonicClock clock,
                           MonotonicScheduler scheduler)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.target = Objects.requireNonNull(target, "target");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public InetSocketAddress target()
    {
        return target;
    }

    /**
     * Generates one message and sends it over a new connection.
     *
     * @throws IllegalArgumentException if the template is unknown
     */
    public ExchangeOutcome pushOnce(String templateId) throws InterruptedException
    {
        final AstmMessage message = generator.generate(templateId, null);
        final String sessionId = "push-" + pushCounter.incrementAndGet();

        final LinkConnection connection;
        try {
            connection = connector.connect(target);
        } catch (IOException e) {
            log.warn("[{}] Cannot reach {}: {}", sessionId, target, e.getMessage());
            return ExchangeOutcome.TRANSPORT_CLOSED;
        }

        try {
            AstmLinkSession session = AstmLinkSession.builder()
                    .withSessionId(sessionId)
                    .withConnection(connection)
                    .withTimingPolicy(timingPolicy)
                    .withMessageGenerator(generator, templateId)
                    .withObservabilitySink(observability)
                    .build();
            return session.transmit(message);
        } finally {
            connection.close();
        }
    }

    /**
     * Pushes {@code count} messages one after another.
     */
    public PushReport pushBatch(String templateId, int count, Duration interval) throws InterruptedException
    {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        Objects.requireNonNull(interval, "interval");

        List<PushReport.Attempt> attempts = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            ExchangeOutcome outcome = pushOnce(templateId);
            attempts.add(new PushReport.Attempt(i, outcome));
            log.info("Push {}/{} to {}: {}", i, count, target, outcome);

            if (i < count && !interval.isZero()) {
                TimeUnit.NANOSECONDS.sleep(interval.toNanos());
            }
        }

        PushReport report = new PushReport(attempts);
        log.info("Push batch complete: {} of {} succeeded", report.successful(), report.total());
        return report;
    }

    /**
     * Starts pushing one message now and then every {@code interval}.
     *
     * @throws IllegalStateException if continuous push is already running
     */
    public void startContinuous(String templateId, Duration interval)
    {
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(interval, "interval");

        synchronized (continuousLock) {
            if (continuous) {
                throw new IllegalStateException("Continuous push already running");
            }
            continuous = true;
            log.info("Continuous push to {} every {} ms", target, interval.toMillis());
            nextRound = scheduler.scheduleAfter(Duration.ZERO, clock, () -> round(templateId, interval));
        }
    }

    public void stopContinuous()
    {
        synchronized (continuousLock) {
            continuous = false;
            if (nextRound != null) {
                nextRound.cancel();
                nextRound = null;
            }
        }
    }

    public boolean isContinuousRunning()
    {
        synchronized (continuousLock) {
            return continuous;
        }
    }

    private void round(String templateId, Duration interval)
    {
        try {
            ExchangeOutcome outcome = pushOnce(templateId);
            log.info("Continuous push to {}: {}", target, outcome);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopContinuous();
            return;
        } catch (RuntimeException e) {
            log.error("Continuous push failed, stopping", e);
            stopContinuous();
            return;
        }

        synchronized (continuousLock) {
            if (continuous) {
                nextRound = scheduler.scheduleAfter(interval, clock, () -> round(templateId, interval));
            }
        }
    }
}
