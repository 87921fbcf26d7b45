package com.companya.analytics.repository;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds {@code INSERT ... ON DUPLICATE KEY UPDATE} statements whose named
 * parameters are the camelCase form of each column, matching the row's bean
 * properties.
 */
final class UpsertStatements {

    static final String EVENT_TIMESTAMP = "event_timestamp";

    private UpsertStatements() {
    }

    /**
     * Every column except the key columns and {@code created_at} is overwritten on conflict.
     */
    static String fullUpsert(String table, List<String> columns, Set<String> keyColumns) {
        String updates = columns.stream()
                .filter(column -> !keyColumns.contains(column) && !"created_at".equals(column))
                .map(column -> column + " = VALUES(" + column + ")")
                .collect(Collectors.joining(", "));
        return insert(table, columns) + " ON DUPLICATE KEY UPDATE " + updates;
    }

    /**
     * Only {@code mutableColumns} and the bookkeeping columns change on conflict, and
     * only when the incoming event is not older than the one last applied.
     * {@code event_timestamp} is assigned last: MySQL evaluates assignments left to
     * right, so the guard must see the stored value throughout.
     */
    static String selectiveUpsert(String table, List<String> columns, List<String> mutableColumns) {
        String guard = "(" + EVENT_TIMESTAMP + " IS NULL OR VALUES(" + EVENT_TIMESTAMP + ") IS NULL OR VALUES("
                + EVENT_TIMESTAMP + ") >= " + EVENT_TIMESTAMP + ")";
        StringBuilder updates = new StringBuilder();
        for (String column : mutableColumns) {
            updates.append(column).append(" = CASE WHEN ").append(guard)
                    .append(" THEN VALUES(").append(column).append(") ELSE ").append(column).append(" END, ");
        }
        updates.append("event_id = CASE WHEN ").append(guard).append(" THEN VALUES(event_id) ELSE event_id END, ");
        updates.append(EVENT_TIMESTAMP).append(" = CASE WHEN ").append(guard)
                .append(" THEN COALESCE(VALUES(").append(EVENT_TIMESTAMP).append("), ").append(EVENT_TIMESTAMP)
                .append(") ELSE ").append(EVENT_TIMESTAMP).append(" END");
        return insert(table, columns) + " ON DUPLICATE KEY UPDATE " + updates;
    }

    static String insert(String table, List<String> columns) {
        String names = String.join(", ", columns);
        String params = columns.stream().map(column -> ":" + parameterName(column)).collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + names + ") VALUES (" + params + ")";
    }

    static String parameterName(String column) {
        StringBuilder name = new StringBuilder(column.length());
        boolean upper = false;
        for (char c : column.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                name.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return name.toString();
    }
}
