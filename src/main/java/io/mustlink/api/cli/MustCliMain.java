package io.mustlink.api.cli;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.mustlink.api.cli.commands.DataCommand;
import io.mustlink.api.cli.commands.ParamsCommand;
import io.mustlink.api.cli.commands.ProvidersCommand;
import io.mustlink.api.cli.commands.TablesCommand;
import io.mustlink.api.cli.commands.TimelineCommand;
import io.mustlink.api.cli.commands.WhoamiCommand;
import io.mustlink.api.clients.InvalidArgumentException;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.config.MustClientConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line access to a MUSTlink telemetry archive.
 *
 * Usage:
 *   mustlink providers                                  # List data providers
 *   mustlink params info NCADAF41 --provider BEPICOLOMBO
 *   mustlink data fetch NCADAF41 NCADAF42 --from "2024-01-01 00:00:00"
 *   mustlink timeline NCADM001 --from 2024-01-01 --to 2024-01-02
 */
@Command(
    name = "mustlink",
    description = "MUSTlink client - query providers, tables and parameters of a WebMUST archive",
    mixinStandardHelpOptions = true,
    version = "mustlink 1.0.0",
    subcommands = {
        WhoamiCommand.class,
        ProvidersCommand.class,
        TablesCommand.class,
        ParamsCommand.class,
        DataCommand.class,
        TimelineCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MustCliMain implements Callable<Integer> {

    @Option(names = {"-c", "--config"},
            description = "Properties file with mustlink.* settings")
    private File configFile;

    @Option(names = {"--url"},
            description = "MUSTlink service URL (overrides config)")
    private String url;

    @Option(names = {"--credentials"},
            description = "YAML credentials file (overrides config)")
    private String credentials;

    @Option(names = {"--proxy"},
            description = "SOCKS5 proxy as hostname:port (overrides config)")
    private String proxy;

    @Option(names = {"-p", "--provider"},
            description = "Default data provider (overrides config)")
    private String provider;

    @Option(names = {"--debug"},
            description = "Enable debug logging (shows API calls and other debug info)")
    private boolean debug;

    @Option(names = {"--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: TABLE)",
            defaultValue = "TABLE")
    private OutputFormat format;

    public static void main(String[] args) {
        int exitCode = createCommandLine(new MustCliMain()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine createCommandLine(MustCliMain main) {
        CommandLine cmd = new CommandLine(main);
        cmd.setExecutionStrategy(parseResult -> {
            main.applyGlobalOptions();
            return new CommandLine.RunLast().execute(parseResult);
        });
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("❌ Error: " + ex.getMessage());
            if (GlobalConfig.isDebug()) {
                ex.printStackTrace(commandLine.getErr());
            }
            return 1;
        });
        return cmd;
    }

    private void applyGlobalOptions() {
        GlobalConfig.setDebug(debug);
        GlobalConfig.setFormat(format);
        GlobalConfig.setOverrides(collectOverrides());

        if (debug) {
            setLogLevel("io.mustlink", "DEBUG");
        } else {
            setLogLevel("io.mustlink", "WARN");
        }
    }

    private Map<String, String> collectOverrides() {
        Map<String, String> overrides = new HashMap<>();
        if (configFile != null) {
            Properties fileProps = new Properties();
            try (InputStream input = new FileInputStream(configFile)) {
                fileProps.load(input);
            } catch (IOException e) {
                throw new InvalidArgumentException("Cannot read configuration file " + configFile + ": " + e.getMessage());
            }
            fileProps.stringPropertyNames().forEach(key -> overrides.put(key, fileProps.getProperty(key)));
        }
        putIfSet(overrides, MustClientConfig.URL, url);
        putIfSet(overrides, MustClientConfig.CREDENTIALS_FILE, credentials);
        putIfSet(overrides, MustClientConfig.PROXY, proxy);
        putIfSet(overrides, MustClientConfig.DEFAULT_PROVIDER, provider);
        if (debug) {
            overrides.put(MustClientConfig.DEBUG_LEVEL, "1");
        }
        return overrides;
    }

    private static void putIfSet(Map<String, String> overrides, String key, String value) {
        if (value != null && !value.trim().isEmpty()) {
            overrides.put(key, value.trim());
        }
    }

    private static void setLogLevel(String loggerName, String levelStr) {
        Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
        Level level = Level.toLevel(levelStr, Level.INFO);
        logger.setLevel(level);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public enum OutputFormat {
        TABLE, JSON, CSV
    }

    // Global configuration access
    public static class GlobalConfig {
        private static boolean debug;
        private static OutputFormat format = OutputFormat.TABLE;
        private static Map<String, String> overrides = Map.of();

        public static MustClientConfig getMustConfig() {
            return MustClientConfig.getInstance().withOverrides(overrides);
        }

        /**
         * Authenticated client for the current command line settings.
         */
        public static MustApiClient connect() {
            return MustApiClient.connect(getMustConfig());
        }

        public static boolean isDebug() {
            return debug;
        }

        public static void setDebug(boolean debug) {
            GlobalConfig.debug = debug;
        }

        public static OutputFormat getFormat() {
            return format;
        }

        public static void setFormat(OutputFormat format) {
            GlobalConfig.format = format != null ? format : OutputFormat.TABLE;
        }

        public static void setOverrides(Map<String, String> overrides) {
            GlobalConfig.overrides = Map.copyOf(overrides);
        }
    }
}
