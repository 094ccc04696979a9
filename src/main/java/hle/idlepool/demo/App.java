package hle.idlepool.demo;

import hle.idlepool.pool.PoolStats;
import hle.idlepool.pool.ResourcePool;
import hle.idlepool.pool.ResourcePoolConfig;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class App {
    private static final int DEFAULT_THREADS = 16;
    private static final int DEFAULT_CYCLES = 10_000;
    private static final int DEFAULT_MAX_CAPACITY = 10;
    private static final int DEFAULT_IDLE_TIMEOUT_MS = 15_000;
    private static final int DEFAULT_DIAL_MS = 0;
    private static final int DEFAULT_SEND_MS = 0;
    private static final String DEFAULT_MODE = "get-put";

    private static final Set<String> VALUE_OPTIONS =
            Set.of("threads", "cycles", "max-capacity", "idle-timeout-ms", "dial-ms", "send-ms", "mode");

    private App() {
    }

    public static void main(String[] args) {
        Map<String, String> options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return;
        }

        if (options.containsKey("help")) {
            printUsage();
            return;
        }

        int threads;
        int cycles;
        int maxCapacity;
        int idleTimeoutMs;
        int dialMs;
        int sendMs;
        CycleRunner.Mode mode;
        try {
            threads = intOption(options, "threads", DEFAULT_THREADS);
            cycles = intOption(options, "cycles", DEFAULT_CYCLES);
            maxCapacity = intOption(options, "max-capacity", DEFAULT_MAX_CAPACITY);
            idleTimeoutMs = intOption(options, "idle-timeout-ms", DEFAULT_IDLE_TIMEOUT_MS);
            dialMs = intOption(options, "dial-ms", DEFAULT_DIAL_MS);
            sendMs = intOption(options, "send-ms", DEFAULT_SEND_MS);
            mode = parseMode(options.getOrDefault("mode", DEFAULT_MODE));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return;
        }

        if (!validateOptions(threads, cycles, dialMs, sendMs)) {
            return;
        }

        SimulatedConnectionFactory connections = new SimulatedConnectionFactory(dialMs);
        ResourcePoolConfig<SimulatedConnection> config = ResourcePoolConfig.<SimulatedConnection>builder()
                .pooledObjectFactory(connections)
                .maxCapacity(maxCapacity)
                .idleTimeout(Duration.ofMillis(idleTimeoutMs))
                .build();

        try (ResourcePool<SimulatedConnection> pool = new ResourcePool<>(config)) {
            CycleRunner<SimulatedConnection> runner = new CycleRunner<>(pool);
            RunResult result = runner.run(threads, cycles, mode, connection -> connection.send(sendMs));
            printSummary(threads, cycles, pool.getMaxCapacity(), idleTimeoutMs, mode, result, connections);
            pool.logStats();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Run interrupted.");
        } catch (Exception e) {
            System.err.println("Run failed: " + e.getMessage());
        }
    }

    static CycleRunner.Mode parseMode(String raw) {
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "get-put":
                return CycleRunner.Mode.GET_PUT;
            case "get-close":
                return CycleRunner.Mode.GET_CLOSE;
            default:
                throw new IllegalArgumentException("Invalid value for --mode: " + raw);
        }
    }

    static boolean validateOptions(int threads, int cycles, int dialMs, int sendMs) {
        if (threads <= 0) {
            System.err.println("threads must be > 0");
            return false;
        }
        if (cycles <= 0) {
            System.err.println("cycles must be > 0");
            return false;
        }
        if (dialMs < 0 || sendMs < 0) {
            System.err.println("dial-ms/send-ms must be >= 0");
            return false;
        }
        try {
            CycleRunner.totalCycles(threads, cycles);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return false;
        }
        return true;
    }

    private static void printSummary(int threads,
                                     int cycles,
                                     int maxCapacity,
                                     int idleTimeoutMs,
                                     CycleRunner.Mode mode,
                                     RunResult result,
                                     SimulatedConnectionFactory connections) {
        PoolStats poolStats = result.getPoolStats();

        System.out.println("=== Pool Run Summary ===");
        System.out.printf("mode=%s, threads=%d, cyclesPerThread=%d, maxCapacity=%d, idleTimeoutMs=%d%n",
                mode, threads, cycles, maxCapacity, idleTimeoutMs);
        System.out.printf("cycles=%d, failures=%d, totalTime=%.2fs, throughput=%.2f cycles/s%n",
                result.getCycles(), result.getFailures(),
                result.getTotalTimeNanos() / 1_000_000_000.0, result.getThroughputPerSec());
        System.out.printf("hitRatio=%.1f%% (reused=%d, created=%d)%n",
                result.getHitRatio() * 100, poolStats.getHits(), connections.getCreatedCount());
        System.out.printf("discarded: stale=%d, overflow=%d, closed=%d, stillIdle=%d%n",
                poolStats.getStaleEvictions(), poolStats.getOverflowCloses(),
                connections.getClosedCount(), poolStats.getIdle());
    }

    /**
     * Reads {@code --name value} and {@code --name=value} pairs plus the {@code --help}/{@code -h} flag.
     *
     * @throws IllegalArgumentException on an unknown option, a stray argument or a missing value
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new LinkedHashMap<>();
        int i = 0;
        while (i < args.length) {
            String arg = args[i++];
            if ("--help".equals(arg) || "-h".equals(arg)) {
                options.put("help", "true");
                continue;
            }
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }

            String name = arg.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (!VALUE_OPTIONS.contains(name)) {
                throw new IllegalArgumentException("Unknown option: --" + name);
            }
            if (value == null) {
                if (i >= args.length || args[i].startsWith("--")) {
                    throw new IllegalArgumentException("Missing value for --" + name);
                }
                value = args[i++];
            }
            if (options.put(name, value) != null) {
                throw new IllegalArgumentException("Option given twice: --" + name);
            }
        }
        return options;
    }

    static int intOption(Map<String, String> options, String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " expects an integer, got: " + value);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -cp <classpath> hle.idlepool.demo.App [options]");
        System.out.println("Options (--name value or --name=value):");
        System.out.println("  --threads <int>          Parallel threads (default: " + DEFAULT_THREADS + ")");
        System.out.println("  --cycles <int>           Acquire/return cycles per thread (default: " + DEFAULT_CYCLES + ")");
        System.out.println("  --max-capacity <int>     Max idle connections kept, <= 0 means 10 (default: " + DEFAULT_MAX_CAPACITY + ")");
        System.out.println("  --idle-timeout-ms <int>  Idle timeout, <= 0 disables it (default: " + DEFAULT_IDLE_TIMEOUT_MS + ")");
        System.out.println("  --dial-ms <int>          Time to open a connection (default: " + DEFAULT_DIAL_MS + ")");
        System.out.println("  --send-ms <int>          Time spent using a connection (default: " + DEFAULT_SEND_MS + ")");
        System.out.println("  --mode <get-put|get-close>  Return connections to the pool or close them (default: " + DEFAULT_MODE + ")");
        System.out.println("  --help                   Show this help");
    }
}
