package io.mustlink.api.cli.commands;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.cli.MustCliMain.OutputFormat;
import io.mustlink.api.cli.utils.OutputFormatter;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.clients.MustApiException;
import io.mustlink.api.clients.MustParametersClient;
import io.mustlink.api.model.CatalogNode;
import io.mustlink.api.model.ParameterInfo;
import io.mustlink.api.model.Representation;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI commands for parameter metadata.
 */
@Command(
    name = "params",
    description = "Look up and search telemetry parameters",
    mixinStandardHelpOptions = true,
    subcommands = {
        ParamsCommand.InfoCommand.class,
        ParamsCommand.SearchCommand.class,
        ParamsCommand.TreeCommand.class
    }
)
public class ParamsCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Use 'mustlink params --help' to see available parameter commands");
        return 0;
    }

    @Command(name = "info", description = "Show metadata and monitoring limits of a parameter",
            mixinStandardHelpOptions = true)
    static class InfoCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Parameter name")
        private String parameter;

        @Option(names = {"--mode"}, description = "Lookup mode: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
                defaultValue = "COMPLEX")
        private Representation mode;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                ParameterInfo info = client.parameters().getParameterInfo(parameter, provider, mode);
                OutputFormatter.printParameterDetails(info, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("reading parameter info", e);
            }
        }
    }

    @Command(name = "search", description = "Search parameters by name or description", mixinStandardHelpOptions = true)
    static class SearchCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Search text")
        private String text;

        @Option(names = {"--by"}, description = "Field to search: name or description (default: ${DEFAULT-VALUE})",
                defaultValue = "description")
        private String searchBy;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                List<ParameterInfo> matches = client.parameters().searchParameters(text, searchBy, provider);
                if (GlobalConfig.getFormat() == OutputFormat.TABLE) {
                    System.out.println("🔍 Found " + matches.size() + " parameter(s) matching '" + text + "':");
                }
                OutputFormatter.printParameters(matches, GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("searching parameters", e);
            }
        }
    }

    @Command(name = "tree", description = "Find a node of the provider's metadata tree", mixinStandardHelpOptions = true)
    static class TreeCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Search text")
        private String text;

        @Option(names = {"--fields"}, description = "Fields to search (default: ${DEFAULT-VALUE})",
                defaultValue = MustParametersClient.DEFAULT_TREE_FIELDS)
        private String fields;

        @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
        private String provider;

        @Override
        public Integer call() {
            try {
                MustApiClient client = GlobalConfig.connect();
                Optional<CatalogNode> node = client.parameters().treeSearch(text, fields, provider);
                if (node.isEmpty()) {
                    System.out.println("📭 No tree node matches '" + text + "'");
                    return 0;
                }
                OutputFormatter.printDetails(node.get().getAttributes(), GlobalConfig.getFormat());
                return 0;
            } catch (MustApiException e) {
                return CommandSupport.report("searching the metadata tree", e);
            }
        }
    }
}
