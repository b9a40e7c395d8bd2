package com.vedant.dataquery.session;

import com.vedant.dataquery.engine.DuckDbEngine;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.service.TableCatalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one user session: its private engine and catalog, the names of the files currently
 * uploaded, and the last query result with its edited copy.
 * <p>
 * Services synchronize on the session object, so one session handles one action at a time.
 */
public class WorkspaceSession implements AutoCloseable {

    private final String id;
    private final DuckDbEngine engine;
    private final TableCatalog catalog;

    private List<String> uploadedFiles = Collections.emptyList();
    private DataTable queryResult;
    private DataTable editedResult;

    public WorkspaceSession(String id, DuckDbEngine engine) {
        this.id = id;
        this.engine = engine;
        this.catalog = new TableCatalog(engine);
    }

    public String getId() {
        return id;
    }

    public DuckDbEngine engine() {
        return engine;
    }

    public TableCatalog catalog() {
        return catalog;
    }

    public List<String> getUploadedFiles() {
        return uploadedFiles;
    }

    public void setUploadedFiles(List<String> uploadedFiles) {
        this.uploadedFiles = Collections.unmodifiableList(new ArrayList<>(uploadedFiles));
    }

    public DataTable getQueryResult() {
        return queryResult;
    }

    public void setQueryResult(DataTable queryResult) {
        this.queryResult = queryResult;
        this.editedResult = null;
    }

    public DataTable getEditedResult() {
        return editedResult;
    }

    public void setEditedResult(DataTable editedResult) {
        this.editedResult = editedResult;
    }

    /** What an export writes: the edited copy when there is one, otherwise the query result. */
    public DataTable currentResult() {
        return editedResult != null ? editedResult : queryResult;
    }

    public void clearResults() {
        queryResult = null;
        editedResult = null;
    }

    /**
     * Drops every table and forgets uploads and results.
     *
     * @return warnings from tables the engine failed to drop
     */
    public List<String> reset() {
        List<String> warnings = catalog.clear();
        uploadedFiles = Collections.emptyList();
        clearResults();
        return warnings;
    }

    @Override
    public void close() {
        engine.close();
    }
}
