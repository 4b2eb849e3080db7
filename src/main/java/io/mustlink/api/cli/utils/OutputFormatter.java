package io.mustlink.api.cli.utils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.mustlink.api.cli.MustCliMain.OutputFormat;
import io.mustlink.api.model.AlignedSeries;
import io.mustlink.api.model.ParameterInfo;
import io.mustlink.api.timeline.Timeline;
import io.mustlink.api.timeline.TimelineSegment;
import io.mustlink.api.util.MustTimeUtils;

/**
 * Utility class for formatting CLI output in various formats
 */
public class OutputFormatter {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_COLUMN_WIDTH = 40;

    public static void printRows(List<String> headers, List<Map<String, Object>> rows, OutputFormat format) {
        switch (format) {
            case JSON:
                printJson(toPlainRows(rows));
                break;
            case CSV:
                printCsv(headers, rows);
                break;
            case TABLE:
            default:
                printTable(headers, rows);
                break;
        }
    }

    public static void printDetails(Map<String, Object> details, OutputFormat format) {
        switch (format) {
            case JSON:
                printJson(toPlainRow(details));
                break;
            case CSV:
                printCsv(new ArrayList<>(details.keySet()), List.of(details));
                break;
            case TABLE:
            default:
                System.out.println();
                details.forEach(OutputFormatter::printField);
                System.out.println();
                break;
        }
    }

    public static void printParameters(List<ParameterInfo> parameters, OutputFormat format) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ParameterInfo info : parameters) {
            rows.add(parameterRow(info));
        }
        printRows(List.of("Name", "Description", "Unit", "First Sample", "Last Sample"), rows, format);
    }

    public static void printParameterDetails(ParameterInfo info, OutputFormat format) {
        Map<String, Object> details = parameterRow(info);
        details.put("Soft Low", info.getSoftLow());
        details.put("Soft High", info.getSoftHigh());
        details.put("Hard Low", info.getHardLow());
        details.put("Hard High", info.getHardHigh());
        details.put("Check Calibrated", info.getCheckCalibrated());
        details.put("Check Interpretation", info.getCheckInterpretation());
        printDetails(details, format);
    }

    public static void printSeries(AlignedSeries series, OutputFormat format) {
        List<String> headers = new ArrayList<>();
        headers.add("Time");
        headers.addAll(series.getParameters());

        List<Map<String, Object>> rows = new ArrayList<>();
        series.toValueTable().forEach((timestamp, values) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("Time", timestamp);
            row.putAll(values);
            rows.add(row);
        });
        printRows(headers, rows, format);
    }

    public static void printTimeline(Timeline timeline, OutputFormat format) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TimelineSegment segment : timeline.getSegments()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("Start", segment.getStart());
            row.put("End", segment.getEnd());
            row.put("Value", segment.getValue());
            row.put("Label", timeline.getLabel(segment.getValue()));
            row.put("Gap", segment.isGap());
            rows.add(row);
        }
        printRows(List.of("Start", "End", "Value", "Label", "Gap"), rows, format);
    }

    private static Map<String, Object> parameterRow(ParameterInfo info) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Name", info.getName());
        row.put("Description", info.getDescription());
        row.put("Unit", info.getUnit());
        row.put("First Sample", info.getFirstSample() != null ? info.getFirstSample() : MustTimeUtils.NO_DATA_SENTINEL);
        row.put("Last Sample", info.getLastSample() != null ? info.getLastSample() : MustTimeUtils.NO_DATA_SENTINEL);
        return row;
    }

    private static void printTable(List<String> headers, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return;
        }
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
            for (Map<String, Object> row : rows) {
                widths[i] = Math.max(widths[i], format(row.get(headers.get(i))).length());
            }
            widths[i] = Math.min(widths[i], MAX_COLUMN_WIDTH);
        }

        System.out.println();
        StringBuilder header = new StringBuilder();
        int totalWidth = 0;
        for (int i = 0; i < headers.size(); i++) {
            header.append(String.format("%-" + widths[i] + "s ", truncate(headers.get(i).toUpperCase(), widths[i])));
            totalWidth += widths[i] + 1;
        }
        System.out.println(header.toString().stripTrailing());
        System.out.println("─".repeat(Math.max(0, totalWidth - 1)));

        for (Map<String, Object> row : rows) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < headers.size(); i++) {
                line.append(String.format("%-" + widths[i] + "s ", truncate(format(row.get(headers.get(i))), widths[i])));
            }
            System.out.println(line.toString().stripTrailing());
        }
        System.out.println();
    }

    private static void printCsv(List<String> headers, List<Map<String, Object>> rows) {
        List<String> escapedHeaders = new ArrayList<>();
        headers.forEach(h -> escapedHeaders.add(escapeCsv(h)));
        System.out.println(String.join(",", escapedHeaders));
        for (Map<String, Object> row : rows) {
            List<String> cells = new ArrayList<>();
            for (String header : headers) {
                cells.add(escapeCsv(format(row.get(header))));
            }
            System.out.println(String.join(",", cells));
        }
    }

    private static void printJson(Object object) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object);
            System.out.println(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error formatting JSON: " + e.getMessage(), e);
        }
    }

    private static void printField(String name, Object value) {
        if (value != null) {
            System.out.printf("%-22s: %s%n", name, format(value));
        }
    }

    private static List<Map<String, Object>> toPlainRows(List<Map<String, Object>> rows) {
        List<Map<String, Object>> plain = new ArrayList<>(rows.size());
        rows.forEach(row -> plain.add(toPlainRow(row)));
        return plain;
    }

    // Instants are rendered in the service's request format rather than as epoch numbers
    private static Map<String, Object> toPlainRow(Map<String, Object> row) {
        Map<String, Object> plain = new LinkedHashMap<>();
        row.forEach((key, value) -> plain.put(key, value instanceof Instant ? format(value) : value));
        return plain;
    }

    static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Instant) {
            return MustTimeUtils.formatRequestTimeMillis((Instant) value);
        }
        return value.toString();
    }

    static String truncate(String str, int maxLength) {
        if (str == null) return "";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength - 3) + "...";
    }

    static String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
