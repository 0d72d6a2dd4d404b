package com.questrail.labsim.protocol.astm.config;

import com.questrail.labsim.protocol.astm.internal.exec.AstmTimingPolicy;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the simulator runtime.
 *
 * <p>{@code templatesDirectory} and {@code pushTarget} are nullable: no
 * directory means the bundled templates, no target means push is unavailable.
 * An {@code apiPort} of zero or less disables the HTTP control surface.</p>
 */
public record AstmRuntimeConfig(
    InetSocketAddress listenAddress,
    AstmTimingPolicy timingPolicy,
    String templateId,
    Path templatesDirectory,
    boolean acceptsInbound,
    boolean proactive,
    int maxSessions,
    InetSocketAddress pushTarget,
    int pushCount,
    Duration pushInterval,
    boolean pushContinuous,
    int apiPort
) {
    public static final int DEFAULT_PORT = 5000;
    public static final String DEFAULT_TEMPLATE = "hematology";
    public static final int DEFAULT_MAX_SESSIONS = 10;

    public AstmRuntimeConfig {
        Objects.requireNonNull(listenAddress, "listenAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(pushInterval, "pushInterval");
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1");
        }
        if (pushCount < 1) {
            throw new IllegalArgumentException("pushCount must be >= 1");
        }
        if (pushInterval.isNegative()) {
            throw new IllegalArgumentException("pushInterval must be non-negative");
        }
        if (pushContinuous && pushTarget == null) {
            throw new IllegalArgumentException("continuous push requires a push target");
        }
    }

    public Optional<Path> templatesDirectoryOpt() {
        return Optional.ofNullable(templatesDirectory);
    }

    public Optional<InetSocketAddress> pushTargetOpt() {
        return Optional.ofNullable(pushTarget);
    }

    public boolean apiEnabled() {
        return apiPort > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress listenAddress = new InetSocketAddress(DEFAULT_PORT);
        private AstmTimingPolicy timingPolicy = AstmTimingPolicy.defaults();
        private String templateId = DEFAULT_TEMPLATE;
        private Path templatesDirectory;
        private boolean acceptsInbound = true;
        private boolean proactive;
        private int maxSessions = DEFAULT_MAX_SESSIONS;
        private InetSocketAddress pushTarget;
        private int pushCount = 1;
        private Duration pushInterval = Duration.ofSeconds(1);
        private boolean pushContinuous;
        private int apiPort;

        public Builder withListenAddress(InetSocketAddress listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder withTimingPolicy(AstmTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withTemplateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder withTemplatesDirectory(Path templatesDirectory) {
            this.templatesDirectory = templatesDirectory;
            return this;
        }

        public Builder withAcceptsInbound(boolean acceptsInbound) {
            this.acceptsInbound = acceptsInbound;
            return this;
        }

        public Builder withProactive(boolean proactive) {
            this.proactive = proactive;
            return this;
        }

        public Builder withMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
            return this;
        }

        public Builder withPushTarget(InetSocketAddress pushTarget) {
            this.pushTarget = pushTarget;
            return this;
        }

        public Builder withPushCount(int pushCount) {
            this.pushCount = pushCount;
            return this;
        }

        public Builder withPushInterval(Duration pushInterval) {
            this.pushInterval = pushInterval;
            return this;
        }

        public Builder withPushContinuous(boolean pushContinuous) {
            this.pushContinuous = pushContinuous;
            return this;
        }

        public Builder withApiPort(int apiPort) {
            this.apiPort = apiPort;
            return this;
        }

        public AstmRuntimeConfig build() {
            return new AstmRuntimeConfig(listenAddress, timingPolicy, templateId, templatesDirectory,
                    acceptsInbound, proactive, maxSessions, pushTarget, pushCount, pushInterval,
                    pushContinuous, apiPort);
        }
    }
}
