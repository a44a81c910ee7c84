package net.spookly.hostpilot;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import net.spookly.hostpilot.availability.AvailabilitySettings;
import net.spookly.hostpilot.client.HostpilotClient;
import net.spookly.hostpilot.config.ConfigLoader;
import net.spookly.hostpilot.config.ConfigPrinter;
import net.spookly.hostpilot.config.ConfigWarnings;
import net.spookly.hostpilot.config.HostpilotConfig;

/**
 * Diagnostic entry point: validate a client config, print it, or rank its hosts once.
 */
public final class HostpilotMain {
    private static final String DEFAULT_CONFIG = "config/hostpilot.yaml";

    private HostpilotMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        HostpilotConfig config = ConfigLoader.load(options.configPath);
        emitWarnings(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun || !options.probe) {
            System.out.println("Config OK" + (options.dryRun ? " (--dry-run)." : "."));
            return;
        }
        probe(config);
    }

    /**
     * Build a client, let one scoring pass run, and print the ranked hosts per path.
     */
    private static void probe(HostpilotConfig config) {
        try (HostpilotClient client = HostpilotClient.builder(config).build()) {
            AvailabilitySettings settings = config.availability == null || config.availability.pingTimeoutMs == null
                    ? AvailabilitySettings.defaults()
                    : AvailabilitySettings.defaults().withPingTimeoutMs(config.availability.pingTimeoutMs);
            try {
                Thread.sleep(settings.pingTimeoutMs() + 200L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            for (Map.Entry<String, List<String>> entry : client.availability().currentConfig().asMap().entrySet()) {
                System.out.println(entry.getKey() + " -> " + String.join(", ", entry.getValue()));
            }
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        boolean probe = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig, probe);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
                continue;
            }
            if ("--probe".equals(arg)) {
                probe = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig, probe);
    }

    private static void emitWarnings(HostpilotConfig config) {
        for (String warning : ConfigWarnings.collect(config)) {
            System.err.println("Config warning: " + warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig, boolean probe) {
    }
}
