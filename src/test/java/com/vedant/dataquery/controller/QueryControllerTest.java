package com.vedant.dataquery.controller;

import com.vedant.dataquery.model.Column;
import com.vedant.dataquery.model.ColumnType;
import com.vedant.dataquery.model.DataTable;
import com.vedant.dataquery.model.UnitLabel;
import com.vedant.dataquery.service.ExportService;
import com.vedant.dataquery.service.QueryService;
import com.vedant.dataquery.session.WorkspaceSessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class QueryControllerTest {

    private final WorkspaceSessionRegistry sessions = new WorkspaceSessionRegistry("jdbc:duckdb:", 100);
    private final MockHttpSession httpSession = new MockHttpSession();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        QueryService queryService = new QueryService(5);
        mvc = MockMvcBuilders.standaloneSetup(
                new QueryController(queryService, sessions),
                new ExportController(new ExportService(), sessions)).build();

        DataTable people = DataTable.of(
                List.of(new Column("id", ColumnType.BIGINT), new Column("name", ColumnType.VARCHAR)),
                List.of(Arrays.asList(1L, "ann"), Arrays.asList(2L, "bob")));
        sessions.getOrCreate(httpSession.getId()).catalog().register(UnitLabel.of("people.csv"), null, people);
    }

    @AfterEach
    void tearDown() {
        sessions.closeAll();
    }

    private void runQuery(String sql) throws Exception {
        mvc.perform(post("/api/query").session(httpSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"" + sql + "\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void queryReturnsRowsWithIndex() throws Exception {
        mvc.perform(post("/api/query").session(httpSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT * FROM people_csv ORDER BY id\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowCount").value(2))
                .andExpect(jsonPath("$.index[1]").value(2))
                .andExpect(jsonPath("$.rows[1][1]").value("bob"));
    }

    @Test
    void errorsCarryTheirCategory() throws Exception {
        mvc.perform(post("/api/query").session(httpSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"DROP TABLE people_csv\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("ILLEGAL_MUTATION"));

        mvc.perform(post("/api/query").session(httpSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT * FROM nothing_here\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("UNKNOWN_TABLE"));
    }

    @Test
    void editedResultIsWhatGetsExported() throws Exception {
        runQuery("SELECT * FROM people_csv ORDER BY id");

        mvc.perform(put("/api/query/result").session(httpSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\": [\"id\", \"name\"], \"rows\": [[5, \"eve\"]]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowCount").value(1));

        mvc.perform(get("/api/query/result").session(httpSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows[0][1]").value("eve"));

        mvc.perform(get("/api/export").param("format", "csv").session(httpSession))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("query_result.csv")))
                .andExpect(content().string("id,name\n5,eve\n"));
    }

    @Test
    void exportWithoutResultIsBadRequest() throws Exception {
        mvc.perform(get("/api/export").param("format", "json").session(httpSession))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("NO_RESULT"));
    }

    @Test
    void editChangingColumnsIsRejected() throws Exception {
        runQuery("SELECT * FROM people_csv");

        mvc.perform(put("/api/query/result").session(httpSession)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\": [\"id\"], \"rows\": [[5]]}"))
                .andExpect(status().isBadRequest());
    }
}
