package com.vedant.dataquery.dto;

public class QueryRequestDTO {
    private String sql;

    public QueryRequestDTO() {}

    public QueryRequestDTO(String sql) {
        this.sql = sql;
    }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }
}
