package io.mustlink.api.cli.commands;

import java.time.Clock;

import io.mustlink.api.cli.MustCliMain.GlobalConfig;
import io.mustlink.api.clients.EmptyResultException;
import io.mustlink.api.clients.MustApiException;
import io.mustlink.api.model.TimeWindow;

/**
 * Helpers shared by the subcommands.
 */
final class CommandSupport {

    private CommandSupport() {
    }

    static TimeWindow window(String from, String to) {
        return TimeWindow.parse(from, to, Clock.systemUTC());
    }

    /**
     * Report a failed command. An empty result is not an error for the command line.
     */
    static int report(String action, MustApiException e) {
        if (e instanceof EmptyResultException) {
            System.out.println("📭 " + e.getMessage());
            return 0;
        }
        System.err.println("❌ Error " + action + ": " + e.getMessage());
        if (GlobalConfig.isDebug()) {
            e.printStackTrace();
        }
        return 1;
    }
}
