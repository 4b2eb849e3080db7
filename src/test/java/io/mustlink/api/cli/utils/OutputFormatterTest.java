package io.mustlink.api.cli.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mustlink.api.cli.MustCliMain.OutputFormat;

public class OutputFormatterTest {

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    public void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void tearDown() {
        System.setOut(originalOut);
    }

    private String output() {
        return captured.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    public void testFormatValues() {
        assertEquals("", OutputFormatter.format(null));
        assertEquals("42", OutputFormatter.format(42));
        assertEquals("2024-03-02 10:15:30.250",
                OutputFormatter.format(Instant.parse("2024-03-02T10:15:30.250Z")));
    }

    @Test
    public void testTruncateAndEscape() {
        assertEquals("short", OutputFormatter.truncate("short", 10));
        assertEquals("abcdefg...", OutputFormatter.truncate("abcdefghijklmnop", 10));
        assertEquals("", OutputFormatter.truncate(null, 10));

        assertEquals("plain", OutputFormatter.escapeCsv("plain"));
        assertEquals("\"a,b\"", OutputFormatter.escapeCsv("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", OutputFormatter.escapeCsv("say \"hi\""));
    }

    @Test
    public void testPrintRowsAsCsv() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Name", "NCAD0001");
        row.put("Description", "Bus voltage, main");
        row.put("Unit", null);

        OutputFormatter.printRows(List.of("Name", "Description", "Unit"), List.of(row), OutputFormat.CSV);

        assertEquals("Name,Description,Unit\nNCAD0001,\"Bus voltage, main\",\n", output());
    }

    @Test
    public void testPrintRowsAsJsonRendersInstants() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Time", Instant.parse("2024-03-02T00:00:00Z"));
        row.put("Value", 7);

        OutputFormatter.printRows(List.of("Time", "Value"), List.of(row), OutputFormat.JSON);

        String json = output();
        assertTrue(json.contains("\"Time\" : \"2024-03-02 00:00:00.000\""));
        assertTrue(json.contains("\"Value\" : 7"));
    }

    @Test
    public void testEmptyTablePrintsNothing() {
        OutputFormatter.printRows(List.of("Name"), List.of(), OutputFormat.TABLE);

        assertEquals("", output());
    }
}
