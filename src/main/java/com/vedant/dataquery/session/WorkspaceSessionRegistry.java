package com.vedant.dataquery.session;

import com.vedant.dataquery.engine.DuckDbEngine;
import jakarta.annotation.PreDestroy;
import jakarta.servlet.http.HttpSessionEvent;
import jakarta.servlet.http.HttpSessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link WorkspaceSession} per HTTP session. A session is created on first use and closed
 * on reset or when the HTTP session ends.
 */
@Component
public class WorkspaceSessionRegistry implements HttpSessionListener {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSessionRegistry.class);

    private final String engineUrl;
    private final int insertBatchSize;
    private final Map<String, WorkspaceSession> sessions = new ConcurrentHashMap<>();

    public WorkspaceSessionRegistry(
            @Value("${dataquery.engine.url:jdbc:duckdb:}") String engineUrl,
            @Value("${dataquery.insert.batch-size:1000}") int insertBatchSize
    ) {
        this.engineUrl = engineUrl;
        this.insertBatchSize = insertBatchSize;
    }

    public WorkspaceSession getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.info("Opening workspace for session {}", id);
            return new WorkspaceSession(id, new DuckDbEngine(engineUrl, insertBatchSize));
        });
    }

    /** Closes the session's engine; the next request starts from an empty workspace. */
    public void reset(String sessionId) {
        WorkspaceSession session = sessions.remove(sessionId);
        if (session == null) return;
        synchronized (session) {
            session.reset();
            session.close();
        }
        log.info("Closed workspace for session {}", sessionId);
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void sessionDestroyed(HttpSessionEvent se) {
        reset(se.getSession().getId());
    }

    @PreDestroy
    public void closeAll() {
        for (String id : new ArrayList<>(sessions.keySet())) {
            reset(id);
        }
    }
}
