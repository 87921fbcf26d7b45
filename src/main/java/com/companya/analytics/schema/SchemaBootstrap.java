package com.companya.analytics.schema;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * Creates the replica tables and indexes. Safe to run on every start: objects
 * that already exist are left alone.
 */
@Slf4j
@Service
public class SchemaBootstrap {

    // MySQL: table exists, duplicate key name. H2: table exists, index exists.
    private static final Set<Integer> ALREADY_EXISTS_CODES = Set.of(1050, 1061, 42101, 42111);
    private static final Set<String> ALREADY_EXISTS_STATES = Set.of("42S01", "42S11", "42101", "42111");

    private final JdbcTemplate jdbcTemplate;
    private final List<String> statements;

    @Autowired
    public SchemaBootstrap(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, TableDefinitions.ALL);
    }

    SchemaBootstrap(JdbcTemplate jdbcTemplate, List<String> statements) {
        this.jdbcTemplate = jdbcTemplate;
        this.statements = statements;
    }

    /**
     * @throws SchemaBootstrapException on any failure other than an existing object
     */
    public void initialize() {
        log.info("Bootstrapping replica schema ({} statements)", statements.size());
        for (String ddl : statements) {
            try {
                jdbcTemplate.execute(ddl);
            } catch (DataAccessException ex) {
                if (alreadyExists(ex)) {
                    log.debug("Already present, skipping: {}", firstLine(ddl));
                    continue;
                }
                throw new SchemaBootstrapException("Schema bootstrap failed on: " + firstLine(ddl), ex);
            }
        }
        log.info("Replica schema ready");
    }

    static boolean alreadyExists(DataAccessException ex) {
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof SQLException sql) {
            return ALREADY_EXISTS_CODES.contains(sql.getErrorCode())
                    || (sql.getSQLState() != null && ALREADY_EXISTS_STATES.contains(sql.getSQLState()));
        }
        return false;
    }

    private static String firstLine(String ddl) {
        String trimmed = ddl.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).strip();
    }
}
