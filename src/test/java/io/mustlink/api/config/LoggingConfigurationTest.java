package io.mustlink.api.config;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.joran.spi.JoranException;

public class LoggingConfigurationTest {

    private static String encode(String resource) throws JoranException {
        URL configuration = LoggingConfigurationTest.class.getResource(resource);
        assertNotNull(configuration, resource);

        LoggerContext context = new LoggerContext();
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configuration);

            Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
            @SuppressWarnings("unchecked")
            OutputStreamAppender<ILoggingEvent> appender =
                    (OutputStreamAppender<ILoggingEvent>) root.getAppender("CONSOLE");
            assertNotNull(appender);

            LoggingEvent event = new LoggingEvent(LoggingConfigurationTest.class.getName(),
                    context.getLogger("io.mustlink.api.clients.MustApiBase"), Level.INFO,
                    "GET {} returned {} rows", null, new Object[] { "/dataproviders", 3 });
            return new String(appender.getEncoder().encode(event), StandardCharsets.UTF_8);
        } finally {
            context.stop();
        }
    }

    @Test
    public void testConsolePatternKeepsMessage() throws JoranException {
        String line = encode("/logback.xml");

        assertTrue(line.startsWith("INFO "), line);
        assertTrue(line.contains("[MustApiBase]: GET /dataproviders returned 3 rows"), line);
        assertTrue(line.endsWith(System.lineSeparator()), line);
    }

    @Test
    public void testTestPatternKeepsMessage() throws JoranException {
        String line = encode("/logback-test.xml");

        assertTrue(line.contains("[MustApiBase]: GET /dataproviders returned 3 rows"), line);
        assertTrue(line.endsWith(System.lineSeparator()), line);
    }
}
