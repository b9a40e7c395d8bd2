package com.vedant.dataquery.engine;

import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Blob;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One in-process DuckDB database reached through a single JDBC connection.
 * Every session owns its own instance; scratch instances are used for format conversion.
 */
public class DuckDbEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDbEngine.class);

    public static final String IN_MEMORY_URL = "jdbc:duckdb:";
    private static final int DEFAULT_BATCH_SIZE = 1000;

    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final int batchSize;

    public DuckDbEngine(String url, int batchSize) {
        this.dataSource = new SingleConnectionDataSource(url, true);
        this.dataSource.setDriverClassName("org.duckdb.DuckDBDriver");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
    }

    /** Fresh private in-memory database. */
    public static DuckDbEngine inMemory() {
        return new DuckDbEngine(IN_MEMORY_URL, DEFAULT_BATCH_SIZE);
    }

    /**
     * Creates a table named {@code name} with the table's columns and inserts its rows.
     *
     * @throws DataAccessException if the engine rejects the DDL or an insert
     */
    public void createTable(String name, DataTable table) {
        String createSql = buildCreateTableSql(name, table.columns());
        logger.debug("CREATE SQL: {}", createSql);
        jdbcTemplate.execute(createSql);

        if (table.rowCount() == 0) {
            logger.debug("No rows to insert for table {}", name);
            return;
        }

        String insertSql = buildInsertSql(name, table.columnCount());
        logger.debug("INSERT SQL: {}", insertSql);
        final List<List<Object>> rows = table.rows();
        final List<Column> columns = table.columns();
        for (int from = 0; from < rows.size(); from += batchSize) {
            final List<List<Object>> chunk = rows.subList(from, Math.min(rows.size(), from + batchSize));
            jdbcTemplate.batchUpdate(insertSql, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    List<Object> row = chunk.get(i);
                    for (int c = 0; c < columns.size(); c++) {
                        setPreparedValue(ps, c + 1, row.get(c), columns.get(c).type());
                    }
                }

                @Override
                public int getBatchSize() {
                    return chunk.size();
                }
            });
        }
    }

    public void dropTable(String name) {
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + quoteIdentifier(name));
    }

    public void execute(String sql) {
        jdbcTemplate.execute(sql);
    }

    /** Runs a statement and materializes its result. */
    public DataTable query(String sql) {
        return jdbcTemplate.query(sql, (ResultSetExtractor<DataTable>) DuckDbEngine::toDataTable);
    }

    /** Tables and views currently living in the default schema. */
    public List<String> tableNames() {
        return jdbcTemplate.queryForList(
                "SELECT table_name FROM information_schema.tables " +
                        "WHERE table_schema = current_schema() ORDER BY table_name",
                String.class);
    }

    public boolean tableExists(String name) {
        Integer cnt = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM information_schema.tables " +
                        "WHERE table_schema = current_schema() AND table_name = ?",
                Integer.class, name);
        return cnt != null && cnt > 0;
    }

    @Override
    public void close() {
        dataSource.destroy();
    }

    public static String quoteIdentifier(String id) {
        if (id == null) return "\"\"";
        return "\"" + id.replace("\"", "\"\"") + "\"";
    }

    public static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String buildCreateTableSql(String table, List<Column> columns) {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE ").append(quoteIdentifier(table)).append(" (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(", ");
            Column col = columns.get(i);
            sb.append(quoteIdentifier(col.name())).append(" ").append(col.type().sqlType());
        }
        sb.append(")");
        return sb.toString();
    }

    private static String buildInsertSql(String table, int columnCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("INSERT INTO ").append(quoteIdentifier(table)).append(" VALUES (");
        for (int i = 0; i < columnCount; i++) {
            if (i > 0) sb.append(", ");
            sb.append("?");
        }
        sb.append(")");
        return sb.toString();
    }

    private static void setPreparedValue(PreparedStatement ps, int idx, Object val, ColumnType type) throws SQLException {
        if (val == null) {
            ps.setObject(idx, null);
            return;
        }
        switch (type) {
            case BOOLEAN -> ps.setBoolean(idx, (Boolean) val);
            case BIGINT -> ps.setLong(idx, (Long) val);
            case DOUBLE -> ps.setDouble(idx, (Double) val);
            case DATE -> ps.setDate(idx, Date.valueOf((LocalDate) val));
            case TIMESTAMP -> ps.setTimestamp(idx, Timestamp.valueOf((LocalDateTime) val));
            case BLOB -> ps.setObject(idx, val);
            default -> ps.setString(idx, (String) val);
        }
    }

    private static DataTable toDataTable(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();
        List<String> labels = new ArrayList<>(count);
        List<ColumnType> types = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            labels.add(md.getColumnLabel(i));
            types.add(ColumnType.fromJdbc(md.getColumnType(i)));
        }
        List<String> names = DataTable.uniqueNames(labels);
        List<Column> columns = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            columns.add(new Column(names.get(i), types.get(i)));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                Object v = rs.getObject(i);
                if (v instanceof Blob blob) {
                    v = blob.getBytes(1, (int) blob.length());
                }
                row.add(v);
            }
            rows.add(row);
        }
        return DataTable.of(columns, rows);
    }
}
