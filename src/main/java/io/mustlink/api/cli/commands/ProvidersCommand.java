package io.mustlink.api.cli.commands;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.cli.MustCliMain.OutputFormat;
import io.mustlink.api.cli.utils.OutputFormatter;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.clients.MustApiException;
import picocli.CommandLine.Command;

@Command(name = "providers", description = "List the data providers of the archive", mixinStandardHelpOptions = true)
public class ProvidersCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        try {
            MustApiClient client = GlobalConfig.connect();
            String defaultProvider = client.providers().getDefault();

            List<Map<String, Object>> rows = new ArrayList<>();
            for (String name : client.providers().listProviders()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("Provider", name);
                row.put("Default", name.equals(defaultProvider) ? "*" : "");
                rows.add(row);
            }
            if (GlobalConfig.getFormat() == OutputFormat.TABLE) {
                System.out.println("🔍 Found " + rows.size() + " provider(s):");
            }
            OutputFormatter.printRows(List.of("Provider", "Default"), rows, GlobalConfig.getFormat());
            return 0;
        } catch (MustApiException e) {
            return CommandSupport.report("listing providers", e);
        }
    }
}
