package com.vedant.dataquery.dto;

import com.vedant.dataquery.service.IngestionPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Units of an upload batch and what options each needs, so the client can ask for them before loading.
 */
public class PlanDTO {
    private List<Map<String, Object>> units;
    private List<String> excluded;
    private String message;

    public static PlanDTO from(IngestionPlan plan) {
        PlanDTO dto = new PlanDTO();
        List<Map<String, Object>> units = new ArrayList<>(plan.units().size());
        for (IngestionPlan.Unit u : plan.units()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("label", u.label().display());
            m.put("format", u.format().extension());
            m.put("needsOptions", u.needsOptions());
            m.put("sheets", u.sheetNames());
            units.add(m);
        }
        dto.setUnits(units);
        dto.setExcluded(plan.excluded());
        dto.setMessage("OK");
        return dto;
    }

    public List<Map<String, Object>> getUnits() { return units; }
    public void setUnits(List<Map<String, Object>> units) { this.units = units; }

    public List<String> getExcluded() { return excluded; }
    public void setExcluded(List<String> excluded) { this.excluded = excluded; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
