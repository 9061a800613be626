package org.operaton.fitjourney.migration;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the live SQLite schema: table presence, column names and the stored CREATE statement.
 */
public class SchemaInspector {

    private final JdbcTemplate jdbcTemplate;

    public SchemaInspector(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean tableExists(String table) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?",
                Integer.class, table);
        return count != null && count > 0;
    }

    /**
     * Column names in declaration order; empty if the table does not exist.
     */
    public Set<String> columnNames(String table) {
        List<String> names = jdbcTemplate.query(
                "PRAGMA table_info(" + table + ")",
                (rs, rowNum) -> rs.getString("name"));
        return new LinkedHashSet<>(names);
    }

    public boolean hasColumn(String table, String column) {
        return columnNames(table).contains(column);
    }

    /**
     * True when the table exists but lacks the column.
     */
    public boolean isMissingColumn(String table, String column) {
        return tableExists(table) && !hasColumn(table, column);
    }

    public Optional<String> tableSql(String table) {
        List<String> sql = jdbcTemplate.queryForList(
                "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?",
                String.class, table);
        return sql.stream().findFirst();
    }

    /**
     * Number of rows whose text value in the column is longer than the given length.
     */
    public long countLongerThan(String table, String column, int length) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE length(" + column + ") > ?", Long.class, length);
        return count != null ? count : 0;
    }

    public long rowCount(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0;
    }
}
