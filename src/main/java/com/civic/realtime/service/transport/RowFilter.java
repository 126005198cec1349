package com.civic.realtime.service.transport;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row-level filter in the {@code column=op.value} form used by change-feed channels.
 *
 * Supported operators: {@code eq}, {@code neq} and {@code in.(a,b,c)}.
 */
public final class RowFilter {

    private static final RowFilter MATCH_ALL = new RowFilter(null, null, List.of());

    private final String column;
    private final String operator;
    private final List<String> values;

    private RowFilter(String column, String operator, List<String> values) {
        this.column = column;
        this.operator = operator;
        this.values = values;
    }

    /**
     * Parses a filter expression. A null or blank expression matches every row.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static RowFilter parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return MATCH_ALL;
        }
        int eq = expression.indexOf('=');
        int dot = expression.indexOf('.', eq + 1);
        if (eq <= 0 || dot < 0) {
            throw new IllegalArgumentException("Malformed row filter: " + expression);
        }
        String column = expression.substring(0, eq).trim();
        String operator = expression.substring(eq + 1, dot).trim();
        String operand = expression.substring(dot + 1);

        return switch (operator) {
            case "eq", "neq" -> new RowFilter(column, operator, List.of(operand));
            case "in" -> new RowFilter(column, operator, parseList(expression, operand));
            default -> throw new IllegalArgumentException("Unsupported row filter operator: " + operator);
        };
    }

    public boolean matches(Map<String, Object> row) {
        if (column == null) return true;
        if (row == null) return false;

        String actual = Objects.toString(row.get(column), null);
        return switch (operator) {
            case "eq", "in" -> actual != null && values.contains(actual);
            case "neq" -> actual == null || !values.contains(actual);
            default -> false;
        };
    }

    private static List<String> parseList(String expression, String operand) {
        if (!operand.startsWith("(") || !operand.endsWith(")")) {
            throw new IllegalArgumentException("Malformed row filter: " + expression);
        }
        return Arrays.stream(operand.substring(1, operand.length() - 1).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
