package com.questrail.labsim;

import ch.qos.logback.classic.Level;
import com.questrail.labsim.protocol.astm.config.AstmRuntimeConfig;
import com.questrail.labsim.protocol.astm.config.AstmSimulatorOptions;
import com.questrail.labsim.protocol.astm.runtime.AstmPushService;
import com.questrail.labsim.protocol.astm.runtime.AstmSimulatorRuntime;
import com.questrail.labsim.protocol.astm.runtime.PushReport;
import com.questrail.labsim.template.TemplateException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * <p>With {@code --push} and neither {@code --push-continuous} nor
 * {@code --api-port}, pushes one batch and exits with 0 if every message was
 * acknowledged, 1 otherwise. In every other case it runs as a server until
 * the process is stopped.</p>
 */
public final class AstmSimulatorMain
{
    private static final Logger log = LoggerFactory.getLogger(AstmSimulatorMain.class);

    private AstmSimulatorMain() {}

    public static void main(String[] args)
    {
        final AstmSimulatorOptions options;
        try {
            options = AstmSimulatorOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(AstmSimulatorOptions.USAGE);
            System.exit(2);
            return;
        }
        if (options.helpRequested()) {
            System.out.println(AstmSimulatorOptions.USAGE);
            return;
        }
        if (options.verbose()) {
            enableDebugLogging();
        }

        System.exit(run(options.config()));
    }

    static int run(AstmRuntimeConfig config)
    {
        final AstmSimulatorRuntime runtime;
        try {
            runtime = AstmSimulatorRuntime.builder().withConfig(config).build();
        } catch (TemplateException e) {
            log.error("Cannot start: {}", e.getMessage());
            return 1;
        }

        if (config.pushTarget() != null && !config.pushContinuous() && !config.apiEnabled()) {
            return pushAndExit(runtime, config);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            runtime.stop();
            stopped.countDown();
        }, "astm-shutdown"));

        try {
            runtime.start();
        } catch (IllegalStateException e) {
            log.error("Cannot start: {}", e.getMessage(), e);
            return 1;
        }

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    private static int pushAndExit(AstmSimulatorRuntime runtime, AstmRuntimeConfig config)
    {
        AstmPushService push = runtime.pushService().orElseThrow();
        log.info("Pushing {} message(s) of template {} to {}",
                config.pushCount(), config.templateId(), push.target());
        try {
            PushReport report = push.pushBatch(config.templateId(), config.pushCount(), config.pushInterval());
            return report.allSucceeded() ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        } finally {
            runtime.stop();
        }
    }

    private static void enableDebugLogging()
    {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
