package com.vedant.dataquery.controller;

import com.vedant.dataquery.dto.EditRequestDTO;
import com.vedant.dataquery.dto.MessageDTO;
import com.vedant.dataquery.dto.QueryRequestDTO;
import com.vedant.dataquery.dto.TableDataDTO;
import com.vedant.dataquery.exception.EditRejectedException;
import com.vedant.dataquery.exception.QueryExecutionException;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.service.QueryService;
import com.vedant.dataquery.session.WorkspaceSession;
import com.vedant.dataquery.session.WorkspaceSessionRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/query")
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);

    private final QueryService queryService;
    private final WorkspaceSessionRegistry sessions;

    public QueryController(QueryService queryService, WorkspaceSessionRegistry sessions) {
        this.queryService = queryService;
        this.sessions = sessions;
    }

    @PostMapping
    public ResponseEntity<?> query(@RequestBody QueryRequestDTO req, HttpServletRequest request) {
        try {
            WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
            DataTable result = queryService.execute(session, req.getSql());
            TableDataDTO dto = TableDataDTO.from(result);
            dto.setMessage("OK");
            return ResponseEntity.ok(dto);
        } catch (QueryExecutionException ex) {
            return ResponseEntity.badRequest().body(new MessageDTO(ex.getMessage(), ex.getKind().name()));
        } catch (Exception ex) {
            logger.error("Query failed unexpectedly", ex);
            return ResponseEntity.status(500).body(new MessageDTO("Execution error: " + ex.getMessage()));
        }
    }

    @GetMapping("/result")
    public ResponseEntity<?> result(HttpServletRequest request) {
        WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
        DataTable current;
        synchronized (session) {
            current = session.currentResult();
        }
        if (current == null) {
            return ResponseEntity.badRequest().body(new MessageDTO("No query result available."));
        }
        return ResponseEntity.ok(TableDataDTO.from(current));
    }

    @PutMapping("/result")
    public ResponseEntity<?> edit(@RequestBody EditRequestDTO req, HttpServletRequest request) {
        try {
            WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
            DataTable edited = queryService.applyEdit(session, req.getColumns(), req.getRows());
            TableDataDTO dto = TableDataDTO.from(edited);
            dto.setMessage("OK");
            return ResponseEntity.ok(dto);
        } catch (EditRejectedException ex) {
            return ResponseEntity.badRequest().body(new MessageDTO(ex.getMessage()));
        }
    }
}
