package com.companya.analytics.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

final class JdbcColumns {

    private JdbcColumns() {
    }

    static LocalDateTime timestamp(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, LocalDateTime.class);
    }

    static Integer integer(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, Integer.class);
    }

    static Double decimal(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, Double.class);
    }
}
