package com.questrail.labsim.protocol.astm.runtime;

import com.questrail.labsim.control.AstmControlServer;
import com.questrail.labsim.protocol.astm.MessageGenerator;
import com.questrail.labsim.protocol.astm.ReceivedMessageSink;
import com.questrail.labsim.protocol.astm.config.AstmRuntimeConfig;
import com.questrail.labsim.protocol.astm.internal.time.MonotonicClock;
import com.questrail.labsim.protocol.astm.internal.time.MonotonicScheduler;
import com.questrail.labsim.protocol.astm.internal.time.ScheduledExecutorScheduler;
import com.questrail.labsim.protocol.astm.internal.time.SystemMonotonicClock;
import com.questrail.labsim.protocol.astm.internal.time.SystemWallClock;
import com.questrail.labsim.protocol.astm.observability.AstmObservabilitySink;
import com.questrail.labsim.protocol.astm.observability.Slf4jAstmObservabilitySink;
import com.questrail.labsim.protocol.astm.transport.LinkConnector;
import com.questrail.labsim.protocol.astm.transport.LinkServerEndpoint;
import com.questrail.labsim.protocol.astm.transport.tcp.netty.NettyTcpConnector;
import com.questrail.labsim.protocol.astm.transport.tcp.netty.NettyTcpServerEndpoint;
import com.questrail.labsim.template.TemplateCatalog;
import com.questrail.labsim.template.TemplateMessageGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AstmSimulatorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the simulator: TCP listener,
 * connection manager, optional push service and optional control API.
 */
public final class AstmSimulatorRuntime {
    private static final Logger log = LoggerFactory.getLogger(AstmSimulatorRuntime.class);

    private final AstmRuntimeConfig config;
    private final TemplateCatalog catalog;
    private final LinkServerEndpoint endpoint;
    private final AstmConnectionManager connectionManager;
    private final LinkConnector connector;
    private final AstmPushService pushService;
    private final AstmControlServer controlServer;
    private final ScheduledExecutorService schedulerExecutor;

    private AstmSimulatorRuntime(
            AstmRuntimeConfig config,
            TemplateCatalog catalog,
            LinkServerEndpoint endpoint,
            AstmConnectionManager connectionManager,
            LinkConnector connector,
            AstmPushService pushService,
            AstmControlServer controlServer,
            ScheduledExecutorService schedulerExecutor) {
        this.config = config;
        this.catalog = catalog;
        this.endpoint = endpoint;
        this.connectionManager = connectionManager;
        this.connector = connector;
        this.pushService = pushService;
        this.controlServer = controlServer;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        endpoint.setListener(connectionManager);
        endpoint.start();
        log.info("ASTM simulator listening on {} (template {}, response delay {} ms{})",
                endpoint.localAddress(), config.templateId(),
                config.timingPolicy().responseDelay().toMillis(),
                config.acceptsInbound() ? "" : ", busy");

        if (controlServer != null) {
            controlServer.start();
        }
        if (pushService != null && config.pushContinuous()) {
            pushService.startContinuous(config.templateId(), config.pushInterval());
        }
    }

    public void stop() {
        if (pushService != null) {
            pushService.stopContinuous();
        }
        if (controlServer != null) {
            controlServer.stop();
        }
        endpoint.stop();
        connectionManager.stop();
        if (connector != null) {
            connector.close();
        }
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ASTM simulator stopped");
    }

    public AstmRuntimeConfig config() {
        return config;
    }

    public TemplateCatalog catalog() {
        return catalog;
    }

    /** Bound listen address; valid after {@link #start()}. */
    public InetSocketAddress listenAddress() {
        return endpoint.localAddress();
    }

    /** Bound control API address; empty if the API is disabled. Valid after {@link #start()}. */
    public Optional<InetSocketAddress> controlAddress() {
        return controlServer == null ? Optional.empty() : Optional.of(controlServer.localAddress());
    }

    public AstmConnectionManager connectionManager() {
        return connectionManager;
    }

    public Optional<AstmPushService> pushService() {
        return Optional.ofNullable(pushService);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AstmRuntimeConfig config;
        private TemplateCatalog catalog;
        private ReceivedMessageSink messageSink = new LoggingReceivedMessageSink();
        private AstmObservabilitySink observabilitySink = new Slf4jAstmObservabilitySink();

        public Builder withConfig(AstmRuntimeConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Templates to use instead of loading them as the config says.
         */
        public Builder withCatalog(TemplateCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder withMessageSink(ReceivedMessageSink sink) {
            this.messageSink = sink;
            return this;
        }

        public Builder withObservabilitySink(AstmObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * @throws com.questrail.labsim.template.TemplateException if templates cannot
         *         be loaded or the configured template is unknown
         */
        public AstmSimulatorRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(messageSink, "messageSink");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Templates and message content
            TemplateCatalog templates = catalog != null
                    ? catalog
                    : config.templatesDirectoryOpt()
                            .map(TemplateCatalog::loadDirectory)
                            .orElseGet(TemplateCatalog::loadBundled);
            templates.get(config.templateId());
            MessageGenerator generator = new TemplateMessageGenerator(templates, SystemWallClock.INSTANCE);

            // 2. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "astm-push-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 3. Inbound side
            LinkServerEndpoint endpoint = new NettyTcpServerEndpoint(config.listenAddress());
            AstmConnectionManager manager = new AstmConnectionManager(
                config.maxSessions(),
                config.timingPolicy(),
                config.acceptsInbound(),
                config.proactive(),
                generator,
                config.templateId(),
                messageSink,
                observabilitySink
            );

            // 4. Outbound side, only with a push target
            LinkConnector connector = null;
            AstmPushService pushService = null;
            if (config.pushTarget() != null) {
                connector = new NettyTcpConnector(config.timingPolicy().establishmentTimeout());
                pushService = new AstmPushService(
                    connector,
                    config.pushTarget(),
                    generator,
                    config.timingPolicy(),
                    observabilitySink,
                    clock,
                    scheduler
                );
            }

            // 5. Control API
            AstmControlServer controlServer = null;
            if (config.apiEnabled()) {
                controlServer = new AstmControlServer(
                    new InetSocketAddress(config.apiPort()),
                    templates,
                    config.templateId(),
                    manager::activeSessionCount,
                    pushService
                );
            }

            return new AstmSimulatorRuntime(config, templates, endpoint, manager, connector,
                    pushService, controlServer, schedulerExec);
        }
    }
}
