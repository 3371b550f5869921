package org.carball.querylens.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.analyzer.AnalysisFilter;
import org.carball.querylens.analyzer.QueryLogAnalyzer;
import org.carball.querylens.config.ConfigurationLoader;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.LogAnalysis;
import org.carball.querylens.output.AnalysisReport;
import org.carball.querylens.storage.JsonFileQueryStore;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Map;

/**
 * Offline commands over the persisted query log: {@code analyze} and {@code clear}.
 */
@Slf4j
public class QueryLensCLI {

    private static final String VERSION = "1.0.0";

    private final Map<String, String> environment;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;

    public QueryLensCLI(Map<String, String> environment, Clock clock, PrintStream out, PrintStream err) {
        this.environment = environment;
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        QueryLensCLI cli = new QueryLensCLI(System.getenv(), Clock.systemDefaultZone(), System.out, System.err);
        System.exit(cli.run(args));
    }

    /**
     * @return the process exit code
     */
    public int run(String[] args) {
        if (args.length == 0 || isHelpRequested(args)) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }

        try {
            CommandOptions options = parseArgs(args);
            QueryLensConfig config = loadConfig(options);
            JsonFileQueryStore store = JsonFileQueryStore.fromConfig(config, clock);

            switch (options.getCommand()) {
                case "analyze":
                    return analyze(options, config, store);
                case "clear":
                    return clear(options, config, store);
                default:
                    throw new IllegalArgumentException("Unknown command: " + options.getCommand());
            }
        } catch (IllegalArgumentException e) {
            err.println("❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (RuntimeException e) {
            err.println("❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return 1;
        }
    }

    private int analyze(CommandOptions options, QueryLensConfig config, JsonFileQueryStore store) {
        LocalDate date = options.getDate() != null ? options.getDate() : LocalDate.now(clock);
        AnalysisFilter filter = new AnalysisFilter(options.isSlowOnly(), options.isNPlusOneOnly(), options.getLimit());

        LogAnalysis analysis = new QueryLogAnalyzer(store, config.getSlowQueryThresholdMs()).analyze(date, filter);
        AnalysisReport report = new AnalysisReport(analysis);

        if (options.getFormat() == CommandOptions.OutputFormat.JSON) {
            out.println(report.toJson());
        } else {
            out.print(report.toText());
        }
        return 0;
    }

    private int clear(CommandOptions options, QueryLensConfig config, JsonFileQueryStore store) {
        int days = options.getDays() != null ? options.getDays() : config.getRetentionDays();
        if (days < 0) {
            throw new IllegalArgumentException("--days must not be negative");
        }

        out.println("🧹 Clearing query logs older than " + days + " day(s) from " + store.getBasePath());
        int deleted = store.cleanup(days);
        out.println("✅ Deleted " + deleted + " log file(s)");
        return 0;
    }

    private QueryLensConfig loadConfig(CommandOptions options) {
        ConfigurationLoader loader = new ConfigurationLoader(environment);
        if (options.getProfile() != null) {
            return loader.loadProfile(options.getProfile(), options.getConfigFile());
        }
        return loader.load(options.getConfigFile());
    }

    static CommandOptions parseArgs(String[] args) {
        CommandOptions options = new CommandOptions();
        options.setCommand(args[0]);
        options.setLimit(AnalysisFilter.DEFAULT_LIMIT);

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    options.setConfigFile(Paths.get(requireValue(args, i++, "Configuration file not specified")));
                    break;

                case "--profile":
                    options.setProfile(requireValue(args, i++, "Profile not specified"));
                    break;

                case "--date":
                    String date = requireValue(args, i++, "Date not specified");
                    try {
                        options.setDate(LocalDate.parse(date));
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("Invalid date '" + date + "'. Use YYYY-MM-DD");
                    }
                    break;

                case "--slow":
                    options.setSlowOnly(true);
                    break;

                case "--n-plus-one":
                    options.setNPlusOneOnly(true);
                    break;

                case "--limit":
                    options.setLimit(parseInt(requireValue(args, i++, "Limit not specified"), "--limit"));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        options.setFormat(CommandOptions.OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: text or json");
                    }
                    break;

                case "--days":
                    options.setDays(parseInt(requireValue(args, i++, "Days not specified"), "--days"));
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return options;
    }

    private static String requireValue(String[] args, int optionIndex, String message) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[optionIndex + 1];
    }

    private static int parseInt(String value, String option) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("Query Lens v" + VERSION);
        out.println();
        out.println("Usage: java -jar query-lens.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  analyze             Summarise one day of the query log");
        out.println("  clear               Delete query logs older than the retention period");
        out.println();
        out.println("Options:");
        out.println("  --config, -c        YAML configuration file");
        out.println("  --profile           Configuration preset: development|staging|production");
        out.println("  --date              Day to analyze, YYYY-MM-DD (default: today)");
        out.println("  --slow              Only queries at or above the slow query threshold");
        out.println("  --n-plus-one        Only queries flagged as N+1");
        out.println("  --limit             Maximum number of queries analyzed (default: " + AnalysisFilter.DEFAULT_LIMIT + ")");
        out.println("  --format, -f        Output format for analyze: text|json (default: text)");
        out.println("  --days              Retention override for clear");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.print(ConfigurationLoader.getEnvironmentHelp());
    }
}
