package io.mustlink.api.cli.commands;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.cli.MustCliMain.OutputFormat;
import io.mustlink.api.cli.utils.OutputFormatter;
import io.mustlink.api.clients.InvalidArgumentException;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.clients.MustApiException;
import io.mustlink.api.clients.MustTablesClient;
import io.mustlink.api.model.Representation;
import io.mustlink.api.model.TableDescriptor;
import io.mustlink.api.model.TableMode;
import io.mustlink.api.model.TabularResult;
import io.mustlink.api.util.MustTimeUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI commands for provider tables.
 */
@Command(
    name = "tables",
    description = "List tables of a provider and query their metadata and data",
    mixinStandardHelpOptions = true,
    subcommands = {
        TablesCommand.ListCommand.class,
        TablesCommand.MetaCommand.class,
        TablesCommand.TableDataCommand.class,
        TablesCommand.TableParamsCommand.class,
        TablesCommand.AggregationsCommand.class
    }
)
public class TablesCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use 'mustlink tables --help' to see available table commands");
        return 0;
    }

    @Command(name = "list", description = "List the tables of a provider", mixinStandardHelpOptions = true)
    static class ListCommand implements Callable<Integer> {

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                List<Map<String, Object>> rows = new ArrayList<>();
                for (TableDescriptor table : client.tables().listTables(provider)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("Table", table.getDataType());
                    row.put("Provider", table.getProvider());
                    rows.add(row);
                }
                OutputFormatter.printRows(List.of("Table", "Provider"), rows, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("listing tables", e);
            }
        }
    }

    @Command(name = "meta", description = "Show the metadata of a table", mixinStandardHelpOptions = true)
    static class MetaCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Table name")
        private String table;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                OutputFormatter.printDetails(client.tables().getTableMetadata(table, provider), GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("reading table metadata", e);
            }
        }
    }

    @Command(name = "data", description = "Retrieve table rows over a time window", mixinStandardHelpOptions = true)
    static class TableDataCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Table name")
        private String table;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Option(names = {"--from"}, description = "Window start, yyyy-MM-dd HH:mm:ss UTC (default: 24 hours ago)")
        private String from;

        @Option(names = {"--to"}, description = "Window end, yyyy-MM-dd HH:mm:ss UTC (default: now)")
        private String to;

        @Option(names = {"--filter-key"}, description = "Column to filter on (default: ${DEFAULT-VALUE})",
                defaultValue = MustTablesClient.DEFAULT_FILTER_KEY)
        private String filterKey;

        @Option(names = {"--filter"}, description = "Filter text", defaultValue = "")
        private String filterText;

        @Option(names = {"--max-rows"}, description = "Maximum rows (default: ${DEFAULT-VALUE})", defaultValue = "1000")
        private int maxRows;

        @Option(names = {"--mode"}, description = "Table mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
                defaultValue = "BRIEF")
        private TableMode mode;

        @Option(names = {"--representation"},
                description = "Row representation: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
                defaultValue = "COMPLEX")
        private Representation representation;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                TabularResult result = client.tables().getTableData(table, CommandSupport.window(from, to),
                        filterKey, filterText, provider, maxRows, mode, representation);
                OutputFormatter.printRows(result.getHeaders(), result.getRows(), GlobalConfig.getFormat());
                if (result.isPossiblyTruncated() && GlobalConfig.getFormat() == OutputFormat.TABLE) {
                    System.out.println("⚠️  Row limit reached, results may be truncated (raise --max-rows)");
                }
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("reading table data", e);
            }
        }
    }

    @Command(name = "params", description = "Show the table parameters of a parameter at a given time",
            mixinStandardHelpOptions = true)
    static class TableParamsCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Table name")
        private String table;

        @Parameters(index = "1", description = "Parameter name")
        private String parameter;

        @Option(names = {"--at"}, required = true, description = "Timestamp, yyyy-MM-dd HH:mm:ss[.SSS] UTC")
        private String at;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                Instant timestamp;
                try {
                    timestamp = MustTimeUtils.parseTimestamp(at);
                } catch (DateTimeParseException e) {
                    throw new InvalidArgumentException("unparsable timestamp: " + at);
                }
                MustApiClient client = GlobalConfig.connect();
                TabularResult result = client.tables().getTableParameters(table, parameter, timestamp, provider);
                OutputFormatter.printRows(result.getHeaders(), result.getRows(), GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("reading table parameters", e);
            }
        }
    }

    @Command(name = "aggregations", description = "List the aggregations of a provider", mixinStandardHelpOptions = true)
    static class AggregationsCommand implements Callable<Integer> {

        @Option(names = {"--id"}, description = "Restrict to one aggregation id")
        private String id;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                List<Map<String, Object>> aggregations = client.tables().getAggregations(provider, id);
                List<String> headers = aggregations.isEmpty()
                        ? List.of()
                        : new ArrayList<>(aggregations.get(0).keySet());
                OutputFormatter.printRows(headers, aggregations, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("listing aggregations", e);
            }
        }
    }
}
