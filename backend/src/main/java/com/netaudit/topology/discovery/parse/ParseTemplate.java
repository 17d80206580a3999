package com.netaudit.topology.discovery.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Line-oriented extraction template.
 *
 * <pre>
 * # comment
 * Record ^Device ID:
 * Value Required NEIGHBOR_NAME ^Device ID:\s*(\S+)
 * Value MANAGEMENT_IP ^\s*IP(?:v4)? [Aa]ddress:\s*(\S+)
 * </pre>
 *
 * A line matching {@code Record} starts a new row; without a {@code Record} line the whole
 * output is one row. Each {@code Value} regex is tried on every line and its first capture
 * group from the first matching line becomes the field. Rows missing a {@code Required} value
 * are dropped.
 */
public final class ParseTemplate {
    private static final Pattern VALUE_LINE = Pattern.compile("^Value\\s+(Required\\s+)?([A-Z][A-Z0-9_]*)\\s+(.+)$");
    private static final Pattern RECORD_LINE = Pattern.compile("^Record\\s+(.+)$");

    private final String name;
    private final Pattern recordStart;
    private final List<ValueRule> rules;

    private ParseTemplate(String name, Pattern recordStart, List<ValueRule> rules) {
        this.name = name;
        this.recordStart = recordStart;
        this.rules = rules;
    }

    public static ParseTemplate compile(String name, String source) {
        Pattern recordStart = null;
        List<ValueRule> rules = new ArrayList<>();
        String[] lines = source == null ? new String[0] : source.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            try {
                Matcher record = RECORD_LINE.matcher(line);
                if (record.matches()) {
                    recordStart = Pattern.compile(record.group(1));
                    continue;
                }
                Matcher value = VALUE_LINE.matcher(line);
                if (value.matches()) {
                    Pattern pattern = Pattern.compile(value.group(3));
                    if (pattern.matcher("").groupCount() < 1) {
                        throw new TemplateUnavailableException(
                            "template " + name + " line " + (i + 1) + ": value " + value.group(2) + " has no capture group"
                        );
                    }
                    rules.add(new ValueRule(value.group(2), pattern, value.group(1) != null));
                    continue;
                }
            } catch (PatternSyntaxException e) {
                throw new TemplateUnavailableException("template " + name + " line " + (i + 1) + ": bad regex", e);
            }
            throw new TemplateUnavailableException("template " + name + " line " + (i + 1) + ": unrecognized directive");
        }
        if (rules.isEmpty()) {
            throw new TemplateUnavailableException("template " + name + " defines no values");
        }
        return new ParseTemplate(name, recordStart, List.copyOf(rules));
    }

    public String name() {
        return name;
    }

    public List<Map<String, String>> apply(String rawText) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (rawText == null || rawText.isBlank()) {
            return rows;
        }
        Map<String, String> current = new LinkedHashMap<>();
        for (String line : rawText.split("\\R")) {
            if (recordStart != null && recordStart.matcher(line).find() && !current.isEmpty()) {
                addIfComplete(rows, current);
                current = new LinkedHashMap<>();
            }
            for (ValueRule rule : rules) {
                if (current.containsKey(rule.name())) {
                    continue;
                }
                Matcher matcher = rule.pattern().matcher(line);
                if (matcher.find() && matcher.group(1) != null) {
                    current.put(rule.name(), matcher.group(1).strip());
                }
            }
        }
        addIfComplete(rows, current);
        return rows;
    }

    private void addIfComplete(List<Map<String, String>> rows, Map<String, String> row) {
        if (row.isEmpty()) {
            return;
        }
        for (ValueRule rule : rules) {
            if (rule.required() && !row.containsKey(rule.name())) {
                return;
            }
        }
        rows.add(row);
    }

    private record ValueRule(String name, Pattern pattern, boolean required) {
    }
}
