package com.questrail.labsim.protocol.astm.config;

import com.questrail.labsim.protocol.astm.internal.exec.AstmTimingPolicy;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * AstmSimulatorOptions
 * -----------------------------------------------------------------------------
 * Command-line parsing into an {@link AstmRuntimeConfig}.
 *
 * <p>Environment variables {@code ASTM_PORT}, {@code ANALYZER_TYPE} and
 * {@code RESPONSE_DELAY_MS} supply defaults that flags override.</p>
 */
public final class AstmSimulatorOptions
{
    public static final String ENV_PORT = "ASTM_PORT";
    public static final String ENV_TEMPLATE = "ANALYZER_TYPE";
    public static final String ENV_RESPONSE_DELAY = "RESPONSE_DELAY_MS";

    static final long DEFAULT_RESPONSE_DELAY_MS = 100;

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: astm-simulator [options]",
            "  -p, --port <port>             listen port (env ASTM_PORT, default 5000)",
            "  -t, --template <id>           analyzer template (env ANALYZER_TYPE, default hematology)",
            "      --templates-dir <dir>     load templates from a directory instead of the bundled set",
            "  -d, --response-delay <ms>     delay before each transmission (env RESPONSE_DELAY_MS, default 100)",
            "  -P, --push <host:port>        push results to a listening bridge",
            "  -c, --push-count <n>          messages per push batch (default 1)",
            "  -i, --push-interval <s>       seconds between pushes (default 1)",
            "  -C, --push-continuous         push until stopped",
            "  -a, --api-port <port>         start the HTTP control surface",
            "      --proactive               send a message on every accepted connection",
            "      --busy                    answer every ENQ with NAK",
            "      --max-sessions <n>        concurrent connection limit (default 10)",
            "      --contention-retries <n>  ENQ retries after contention (default 3)",
            "  -v, --verbose                 debug logging",
            "  -h, --help                    show this help");

    private final AstmRuntimeConfig config;
    private final boolean verbose;
    private final boolean help;

    private AstmSimulatorOptions(AstmRuntimeConfig config, boolean verbose, boolean help)
    {
        this.config = config;
        this.verbose = verbose;
        this.help = help;
    }

    public AstmRuntimeConfig config() {
        return config;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean helpRequested() {
        return help;
    }

    /**
     * Parses arguments against the process environment.
     */
    public static AstmSimulatorOptions parse(String[] args)
    {
        return parse(args, System.getenv());
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a missing value or an
     *                                  invalid number
     */
    public static AstmSimulatorOptions parse(String[] args, Map<String, String> env)
    {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(env, "env");

        int port = env.containsKey(ENV_PORT)
                ? parseInt(ENV_PORT, env.get(ENV_PORT))
                : AstmRuntimeConfig.DEFAULT_PORT;
        String template = env.getOrDefault(ENV_TEMPLATE, AstmRuntimeConfig.DEFAULT_TEMPLATE);
        long responseDelayMs = env.containsKey(ENV_RESPONSE_DELAY)
                ? parseInt(ENV_RESPONSE_DELAY, env.get(ENV_RESPONSE_DELAY))
                : DEFAULT_RESPONSE_DELAY_MS;

        AstmRuntimeConfig.Builder b = AstmRuntimeConfig.builder();
        int contentionRetries = AstmTimingPolicy.defaults().maxContentionRetries();
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-p":
                case "--port":
                    port = parseInt(arg, value(args, ++i, arg));
                    break;
                case "-t":
                case "--template":
                case "--analyzer-type":
                    template = value(args, ++i, arg);
                    break;
                case "--templates-dir":
                    b.withTemplatesDirectory(Path.of(value(args, ++i, arg)));
                    break;
                case "-d":
                case "--response-delay":
                    responseDelayMs = parseInt(arg, value(args, ++i, arg));
                    break;
                case "-P":
                case "--push":
                    b.withPushTarget(parseHostPort(value(args, ++i, arg)));
                    break;
                case "-c":
                case "--push-count":
                    b.withPushCount(parseInt(arg, value(args, ++i, arg)));
                    break;
                case "-i":
                case "--push-interval":
                    b.withPushInterval(Duration.ofSeconds(parseInt(arg, value(args, ++i, arg))));
                    break;
                case "-C":
                case "--push-continuous":
                    b.withPushContinuous(true);
                    break;
                case "-a":
                case "--api-port":
                    b.withApiPort(parseInt(arg, value(args, ++i, arg)));
                    break;
                case "--proactive":
                    b.withProactive(true);
                    break;
                case "--busy":
                    b.withAcceptsInbound(false);
                    break;
                case "--max-sessions":
                    b.withMaxSessions(parseInt(arg, value(args, ++i, arg)));
                    break;
                case "--contention-retries":
                    contentionRetries = parseInt(arg, value(args, ++i, arg));
                    break;
                case "-v":
                case "--verbose":
                    verbose = true;
                    break;
                case "-h":
                case "--help":
                    help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (responseDelayMs < 0) {
            throw new IllegalArgumentException("response delay must be non-negative: " + responseDelayMs);
        }

        AstmRuntimeConfig config = b
                .withListenAddress(new InetSocketAddress(port))
                .withTemplateId(template)
                .withTimingPolicy(AstmTimingPolicy.defaults()
                        .withResponseDelay(Duration.ofMillis(responseDelayMs))
                        .withMaxContentionRetries(contentionRetries))
                .build();
        return new AstmSimulatorOptions(config, verbose, help);
    }

    private static String value(String[] args, int index, String flag)
    {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int parseInt(String name, String value)
    {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
    }

    /**
     * Parses {@code host:port}; a leading {@code tcp://} is tolerated.
     */
    static InetSocketAddress parseHostPort(String value)
    {
        String v = value.trim();
        if (v.startsWith("tcp://")) {
            v = v.substring("tcp://".length());
        }
        int colon = v.lastIndexOf(':');
        if (colon <= 0 || colon == v.length() - 1) {
            throw new IllegalArgumentException("Expected host:port, got " + value);
        }
        int port = parseInt("port", v.substring(colon + 1));
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        return InetSocketAddress.createUnresolved(v.substring(0, colon), port);
    }
}
