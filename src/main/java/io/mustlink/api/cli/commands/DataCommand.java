package io.mustlink.api.cli.commands;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.cli.utils.OutputFormatter;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.clients.MustApiException;
import io.mustlink.api.model.AlignedSeries;
import io.mustlink.api.model.ParameterStatistics;
import io.mustlink.api.model.Sample;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI commands for parameter samples.
 */
@Command(
    name = "data",
    description = "Retrieve parameter samples and statistics",
    mixinStandardHelpOptions = true,
    subcommands = {
        DataCommand.FetchCommand.class,
        DataCommand.LatestCommand.class,
        DataCommand.StatsCommand.class
    }
)
public class DataCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use 'mustlink data --help' to see available data commands");
        return 0;
    }

    @Command(name = "fetch", description = "Fetch one or more parameters aligned on time", mixinStandardHelpOptions = true)
    static class FetchCommand implements Callable<Integer> {

        @Parameters(arity = "1..*", description = "Parameter names")
        private List<String> parameters;

        @Option(names = {"--from"}, description = "Window start, yyyy-MM-dd HH:mm:ss UTC (default: 24 hours ago)")
        private String from;

        @Option(names = {"--to"}, description = "Window end, yyyy-MM-dd HH:mm:ss UTC (default: now)")
        private String to;

        @Option(names = {"--calibrated"}, description = "Request calibrated values")
        private boolean calibrated;

        @Option(names = {"--max-points"}, description = "Maximum points per parameter")
        private Integer maxPoints;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                AlignedSeries series = client.timeSeries().getData(parameters, CommandSupport.window(from, to),
                        provider, calibrated, maxPoints);
                OutputFormatter.printSeries(series, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("fetching parameter data", e);
            }
        }
    }

    @Command(name = "latest", description = "Show the most recent sample of a parameter", mixinStandardHelpOptions = true)
    static class LatestCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Parameter name")
        private String parameter;

        @Option(names = {"--calibrated"}, description = "Request calibrated values")
        private boolean calibrated;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                Sample sample = client.timeSeries().getLatestValue(parameter, provider, calibrated);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("Parameter", parameter);
                details.put("Time", sample.getTimestamp());
                details.put("Value", sample.getRawValue());
                if (calibrated) {
                    details.put("Calibrated Value", sample.getCalibratedValue());
                }
                OutputFormatter.printDetails(details, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("reading latest value", e);
            }
        }
    }

    @Command(name = "stats", description = "Show service-side statistics of a parameter", mixinStandardHelpOptions = true)
    static class StatsCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Parameter name")
        private String parameter;

        @Option(names = {"--from"}, description = "Window start, yyyy-MM-dd HH:mm:ss UTC (default: 24 hours ago)")
        private String from;

        @Option(names = {"--to"}, description = "Window end, yyyy-MM-dd HH:mm:ss UTC (default: now)")
        private String to;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                ParameterStatistics stats = client.timeSeries().getStatistics(parameter,
                        CommandSupport.window(from, to), provider);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("Parameter", stats.getParameter());
                details.put("From", stats.getFrom());
                details.put("To", stats.getTo());
                details.putAll(stats.getValues());
                OutputFormatter.printDetails(details, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("reading statistics", e);
            }
        }
    }
}
