package com.vedant.dataquery.dto;

import com.vedant.dataquery.service.IngestionReport;

import java.util.List;
import java.util.Map;

public class IngestionReportDTO {
    private List<String> loaded;
    private List<String> excluded;
    private List<String> removed;
    private List<String> warnings;
    private Map<String, String> tables;
    private String message;

    public IngestionReportDTO() {}

    public static IngestionReportDTO from(IngestionReport report) {
        IngestionReportDTO dto = new IngestionReportDTO();
        dto.setLoaded(report.loaded());
        dto.setExcluded(report.excluded());
        dto.setRemoved(report.removed());
        dto.setWarnings(report.warnings());
        dto.setTables(report.tables());
        dto.setMessage("OK");
        return dto;
    }

    public static IngestionReportDTO failed(String message) {
        IngestionReportDTO dto = new IngestionReportDTO();
        dto.setMessage(message);
        return dto;
    }

    public List<String> getLoaded() { return loaded; }
    public void setLoaded(List<String> loaded) { this.loaded = loaded; }

    public List<String> getExcluded() { return excluded; }
    public void setExcluded(List<String> excluded) { this.excluded = excluded; }

    public List<String> getRemoved() { return removed; }
    public void setRemoved(List<String> removed) { this.removed = removed; }

    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }

    public Map<String, String> getTables() { return tables; }
    public void setTables(Map<String, String> tables) { this.tables = tables; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
