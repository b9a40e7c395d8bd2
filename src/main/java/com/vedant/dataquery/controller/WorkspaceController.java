package com.vedant.dataquery.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.dataquery.dto.IngestionReportDTO;
import com.vedant.dataquery.dto.LoadOptionsDTO;
import com.vedant.dataquery.dto.MessageDTO;
import com.vedant.dataquery.dto.PlanDTO;
import com.vedant.dataquery.dto.TableDataDTO;
import com.vedant.dataquery.exception.DataQueryException;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.LoadOptions;
import com.vedant.dataquery.model.SourceFile;
import com.vedant.dataquery.service.IngestionReport;
import com.vedant.dataquery.service.IngestionService;
import com.vedant.dataquery.service.MapLoadOptionsProvider;
import com.vedant.dataquery.service.QueryService;
import com.vedant.dataquery.session.WorkspaceSession;
import com.vedant.dataquery.session.WorkspaceSessionRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workspace")
public class WorkspaceController {

    private static final Logger logger = LoggerFactory.getLogger(WorkspaceController.class);

    private final IngestionService ingestionService;
    private final QueryService queryService;
    private final WorkspaceSessionRegistry sessions;
    private final ObjectMapper objectMapper;

    public WorkspaceController(IngestionService ingestionService, QueryService queryService,
                               WorkspaceSessionRegistry sessions, ObjectMapper objectMapper) {
        this.ingestionService = ingestionService;
        this.queryService = queryService;
        this.sessions = sessions;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/plan")
    public ResponseEntity<PlanDTO> plan(@RequestPart(value = "files", required = false) List<MultipartFile> files) {
        try {
            return ResponseEntity.ok(PlanDTO.from(ingestionService.plan(toSourceFiles(files))));
        } catch (IOException | DataQueryException ex) {
            PlanDTO dto = new PlanDTO();
            dto.setMessage("Upload failed: " + ex.getMessage());
            return ResponseEntity.badRequest().body(dto);
        }
    }

    /** Replaces the upload set with {@code files}: withdrawn files lose their tables, new ones are loaded. */
    @PutMapping("/files")
    public ResponseEntity<IngestionReportDTO> synchronize(
            @RequestPart(value = "files", required = false) List<MultipartFile> files,
            @RequestParam(value = "options", required = false) String options,
            HttpServletRequest request) {
        try {
            WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
            MapLoadOptionsProvider provider = new MapLoadOptionsProvider(parseOptions(options));
            IngestionReport report = ingestionService.synchronize(session, toSourceFiles(files), provider);
            return ResponseEntity.ok(IngestionReportDTO.from(report));
        } catch (IOException | IllegalArgumentException | DataQueryException ex) {
            return ResponseEntity.badRequest().body(IngestionReportDTO.failed("Upload failed: " + ex.getMessage()));
        } catch (Exception ex) {
            logger.error("Synchronizing uploads failed", ex);
            return ResponseEntity.status(500).body(IngestionReportDTO.failed("Execution error: " + ex.getMessage()));
        }
    }

    @DeleteMapping("/files/{name}")
    public ResponseEntity<IngestionReportDTO> remove(@PathVariable("name") String name, HttpServletRequest request) {
        WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
        return ResponseEntity.ok(IngestionReportDTO.from(ingestionService.remove(session, name)));
    }

    @DeleteMapping
    public ResponseEntity<MessageDTO> reset(HttpServletRequest request) {
        sessions.reset(request.getSession().getId());
        return ResponseEntity.ok(new MessageDTO("Workspace cleared"));
    }

    @GetMapping("/tables")
    public ResponseEntity<Map<String, String>> tables(HttpServletRequest request) {
        WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
        synchronized (session) {
            return ResponseEntity.ok(session.catalog().list());
        }
    }

    @GetMapping("/tables/{name}/preview")
    public ResponseEntity<TableDataDTO> preview(@PathVariable("name") String name,
                                                @RequestParam(value = "rows", defaultValue = "0") int rows,
                                                HttpServletRequest request) {
        try {
            WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
            return ResponseEntity.ok(TableDataDTO.from(queryService.preview(session, name, rows)));
        } catch (DataQueryException ex) {
            return ResponseEntity.badRequest().body(TableDataDTO.message(ex.getMessage()));
        }
    }

    private Map<String, LoadOptions> parseOptions(String json) throws IOException {
        if (json == null || json.isBlank()) return Collections.emptyMap();
        Map<String, LoadOptionsDTO> raw = objectMapper.readValue(json, new TypeReference<Map<String, LoadOptionsDTO>>() {});
        Map<String, LoadOptions> options = new LinkedHashMap<>();
        for (Map.Entry<String, LoadOptionsDTO> e : raw.entrySet()) {
            options.put(e.getKey(), e.getValue().toLoadOptions(FileFormat.fromFileName(e.getKey())));
        }
        return options;
    }

    private static List<SourceFile> toSourceFiles(List<MultipartFile> files) throws IOException {
        if (files == null) return Collections.emptyList();
        List<SourceFile> out = new ArrayList<>(files.size());
        for (MultipartFile f : files) {
            if (f.isEmpty() && (f.getOriginalFilename() == null || f.getOriginalFilename().isBlank())) continue;
            out.add(new SourceFile(f.getOriginalFilename(), f.getBytes()));
        }
        return out;
    }
}
