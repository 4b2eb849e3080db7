package io.mustlink.api.cli.commands;

import java.util.concurrent.Callable;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.cli.MustCliMain.OutputFormat;
import io.mustlink.api.cli.utils.OutputFormatter;
import io.mustlink.api.clients.MustApiClient;
import io.mustlink.api.clients.MustApiException;
import io.mustlink.api.timeline.Timeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "timeline", description = "Segment a discrete parameter into value intervals",
        mixinStandardHelpOptions = true)
public class TimelineCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Parameter name")
    private String parameter;

    @Option(names = {"--from"}, description = "Window start, yyyy-MM-dd HH:mm:ss UTC (default: 24 hours ago)")
    private String from;

    @Option(names = {"--to"}, description = "Window end, yyyy-MM-dd HH:mm:ss UTC (default: now)")
    private String to;

    @Option(names = {"--calibrated"}, description = "Segment calibrated values")
    private boolean calibrated;

    @Option(names = {"-p", "--provider"}, description = "Data provider (default: configured provider)")
    private String provider;

    @Override
    public Integer call() {
        try {
            MustApiClient client = GlobalConfig.connect();
            Timeline timeline = client.timelines().getTimeline(parameter, CommandSupport.window(from, to),
                    provider, calibrated);
            OutputFormatter.printTimeline(timeline, GlobalConfig.getFormat());
            if (GlobalConfig.getFormat() == OutputFormat.TABLE && timeline.getNominalInterval() != null) {
                System.out.println("Nominal sampling interval: " + timeline.getNominalInterval());
            }
            return 0;
        } catch (MustApiException e) {
            return CommandSupport.report("building timeline", e);
        }
    }
}
