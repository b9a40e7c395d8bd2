package com.vedant.dataquery.service;

import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.exception.EditRejectedException;
import com.vedant.dataquery.exception.QueryErrorKind;
import com.vedant.dataquery.exception.QueryExecutionException;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.session.WorkspaceSession;
import com.vedant.dataquery.util.StatementInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs user SQL against a session's catalog, previews tables and takes row edits of the result.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final int previewRows;

    public QueryService(@Value("${dataquery.preview.rows:5}") int previewRows) {
        this.previewRows = previewRows;
    }

    /**
     * Executes one read-only statement. The previous result is dropped first, so after a failure
     * the session has no result.
     *
     * @throws QueryExecutionException classified by {@link QueryErrorKind}
     */
    public DataTable execute(WorkspaceSession session, String sql) {
        synchronized (session) {
            session.clearResults();
            if (sql == null || sql.isBlank()) {
                throw new QueryExecutionException(QueryErrorKind.EMPTY);
            }
            if (!StatementInspector.isReadOnly(sql)) {
                log.warn("Rejected statement starting with '{}'", StatementInspector.leadingKeyword(sql));
                throw new QueryExecutionException(QueryErrorKind.ILLEGAL_MUTATION);
            }

            log.debug("Executing SQL: {}", sql);
            DataTable result = run(session.engine(), sql);
            session.setQueryResult(result);
            log.info("Query executed, {} rows returned", result.rowCount());
            return result;
        }
    }

    /** First rows of a catalog table; {@code rows <= 0} uses the configured preview size. */
    public DataTable preview(WorkspaceSession session, String tableName, int rows) {
        synchronized (session) {
            if (!session.catalog().contains(tableName)) {
                throw new QueryExecutionException(QueryErrorKind.UNKNOWN_TABLE);
            }
            int limit = rows > 0 ? rows : previewRows;
            return run(session.engine(), "SELECT * FROM " + DuckDbEngine.quoteIdentifier(tableName) + " LIMIT " + limit);
        }
    }

    /**
     * Replaces the result shown to the user with an edited copy. Rows may be added or removed;
     * column names and order must stay and values must fit the column types.
     */
    public DataTable applyEdit(WorkspaceSession session, List<String> columnNames, List<? extends List<?>> rows) {
        synchronized (session) {
            DataTable base = session.getQueryResult();
            if (base == null) {
                throw new EditRejectedException("There is no query result to edit.");
            }
            if (columnNames == null || !columnNames.equals(base.columnNames())) {
                throw new EditRejectedException("Edited data must keep the columns " + base.columnNames());
            }
            DataTable edited;
            try {
                edited = DataTable.of(base.columns(), rows);
            } catch (IllegalArgumentException ex) {
                throw new EditRejectedException("Edited data rejected: " + ex.getMessage(), ex);
            }
            session.setEditedResult(edited);
            log.info("Edited result stored, {} rows (was {})", edited.rowCount(), base.rowCount());
            return edited;
        }
    }

    private static DataTable run(DuckDbEngine engine, String sql) {
        try {
            return engine.query(sql);
        } catch (DataAccessException ex) {
            QueryExecutionException classified = classify(ex);
            log.warn("Query failed ({}): {}", classified.getKind(), ex.getMostSpecificCause().getMessage());
            throw classified;
        } catch (IllegalArgumentException ex) {
            throw new QueryExecutionException(QueryErrorKind.OTHER, ex.getMessage(), ex);
        }
    }

    /** The engine reports these conditions only through its message text. */
    static QueryExecutionException classify(DataAccessException ex) {
        String text = String.valueOf(ex.getMostSpecificCause().getMessage());
        if (text.contains("Catalog Error: Table with name") || text.contains("Catalog Error: Table or view with name")) {
            return new QueryExecutionException(QueryErrorKind.UNKNOWN_TABLE, text, ex);
        }
        if (text.contains("Can only update base table") || text.contains("Can only delete from base table")) {
            return new QueryExecutionException(QueryErrorKind.ILLEGAL_MUTATION, text, ex);
        }
        return new QueryExecutionException(QueryErrorKind.OTHER, text, ex);
    }
}
