package io.mustlink.api.cli.commands;

import java.util.concurrent.Callable;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.cli.utils.OutputFormatter;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.clients.MustApiException;
import picocli.CommandLine.Command;

@Command(name = "whoami", description = "Show the user the session is authenticated as", mixinStandardHelpOptions = true)
public class WhoamiCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        try {
            MustApiClient client = GlobalConfig.connect();
            OutputFormatter.printDetails(client.session().currentUser(), GlobalConfig.getFormat());
            return 0;
        } catch (MustApiException e) {
            return CommandSupport.report("reading user info", e);
        }
    }
}
