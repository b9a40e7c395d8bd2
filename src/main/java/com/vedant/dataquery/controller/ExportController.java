package com.vedant.dataquery.controller;

import com.vedant.dataquery.dto.MessageDTO;
import com.vedant.dataquery.exception.ExportException;
import com.vedant.dataquery.model.ExportOptions;
import com.vedant.dataquery.model.FileFormat;
import com.vedant.dataquery.model.QuotingMode;
import com.vedant.dataquery.service.ExportService;
import com.vedant.dataquery.session.WorkspaceSession;
import com.vedant.dataquery.session.WorkspaceSessionRegistry;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/export")
public class ExportController {

    private final ExportService exportService;
    private final WorkspaceSessionRegistry sessions;

    public ExportController(ExportService exportService, WorkspaceSessionRegistry sessions) {
        this.exportService = exportService;
        this.sessions = sessions;
    }

    @GetMapping
    public ResponseEntity<?> export(@RequestParam("format") String format,
                                    @RequestParam(value = "header", defaultValue = "true") boolean header,
                                    @RequestParam(value = "delimiter", defaultValue = ",") String delimiter,
                                    @RequestParam(value = "quoting", defaultValue = "MINIMAL") String quoting,
                                    @RequestParam(value = "quoteChar", defaultValue = "\"") String quoteChar,
                                    HttpServletRequest request) {
        try {
            String delim = "\\t".equals(delimiter) ? "\t" : delimiter;
            if (delim.length() != 1 || quoteChar.length() != 1) {
                throw new IllegalArgumentException("Delimiter and quote character must be single characters");
            }
            ExportOptions options = new ExportOptions(header, delim.charAt(0), QuotingMode.parse(quoting), quoteChar.charAt(0));
            WorkspaceSession session = sessions.getOrCreate(request.getSession().getId());
            ExportService.ExportedFile file = exportService.exportCurrent(session, FileFormat.fromExtension(format), options);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(file.mimeType()))
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(file.fileName()).build().toString())
                    .body(file.content());
        } catch (ExportException ex) {
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                    .body(new MessageDTO(ex.getMessage(), ex.getKind().name()));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                    .body(new MessageDTO(ex.getMessage()));
        }
    }
}
