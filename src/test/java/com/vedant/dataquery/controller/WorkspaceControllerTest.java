package com.vedant.dataquery.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vedant.dataquery.TestFiles;
import com.vedant.dataquery.format.FormatReaderRegistry;
import com.vedant.dataquery.service.IngestionService;
import com.vedant.dataquery.service.QueryService;
import com.vedant.dataquery.session.WorkspaceSessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class WorkspaceControllerTest {

    private final WorkspaceSessionRegistry sessions = new WorkspaceSessionRegistry("jdbc:duckdb:", 100);
    private final MockHttpSession httpSession = new MockHttpSession();
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        WorkspaceController controller = new WorkspaceController(
                new IngestionService(FormatReaderRegistry.withDefaults()), new QueryService(5), sessions, new ObjectMapper());
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @AfterEach
    void tearDown() {
        sessions.closeAll();
    }

    private static MockMultipartFile upload(String name, String content) {
        return new MockMultipartFile("files", name, "text/plain", TestFiles.text(content));
    }

    @Test
    void planListsUnitsAndExclusions() throws Exception {
        mvc.perform(multipart("/api/workspace/plan")
                        .file(upload("a.csv", "x\n1\n"))
                        .file(upload("notes.pdf", "%PDF")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.units[0].label").value("a.csv"))
                .andExpect(jsonPath("$.units[0].needsOptions").value(true))
                .andExpect(jsonPath("$.excluded[0]").value("notes.pdf not loaded. Unsupported file format"));
    }

    @Test
    void uploadWithOptionsThenPreview() throws Exception {
        mvc.perform(multipart(HttpMethod.PUT, "/api/workspace/files")
                        .file(upload("semi.csv", "x;y\n1;2\n3;4\n"))
                        .param("options", "{\"semi.csv\": {\"header\": true, \"delimiter\": \";\"}}")
                        .session(httpSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loaded[0]").value("Loaded semi.csv as table(s): semi_csv"))
                .andExpect(jsonPath("$.tables.semi_csv").value("semi.csv"));

        mvc.perform(get("/api/workspace/tables/semi_csv/preview").param("rows", "1").session(httpSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns[0].name").value("x"))
                .andExpect(jsonPath("$.columns[0].type").value("BIGINT"))
                .andExpect(jsonPath("$.rowCount").value(1))
                .andExpect(jsonPath("$.index[0]").value(1));
    }

    @Test
    void invalidOptionsAreBadRequest() throws Exception {
        mvc.perform(multipart(HttpMethod.PUT, "/api/workspace/files")
                        .file(upload("a.csv", "x\n1\n"))
                        .param("options", "{\"a.csv\": {\"delimiter\": \"\"}}")
                        .session(httpSession))
                .andExpect(status().isBadRequest());
    }

    @Test
    void removeAndResetDropTables() throws Exception {
        mvc.perform(multipart(HttpMethod.PUT, "/api/workspace/files")
                        .file(upload("a.csv", "x\n1\n"))
                        .file(upload("b.csv", "y\n2\n"))
                        .session(httpSession))
                .andExpect(status().isOk());

        mvc.perform(delete("/api/workspace/files/{name}", "a.csv").session(httpSession))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed[0]").value("Removed file: a.csv and its associated tables"))
                .andExpect(jsonPath("$.tables.a_csv").doesNotExist());

        mvc.perform(delete("/api/workspace").session(httpSession))
                .andExpect(status().isOk());

        mvc.perform(get("/api/workspace/tables").session(httpSession))
                .andExpect(status().isOk())
                .andExpect(content().json("{}"));
    }

    @Test
    void previewOfUnknownTableIsBadRequest() throws Exception {
        mvc.perform(get("/api/workspace/tables/ghost/preview").session(httpSession))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Table not existing. Please check table names in your query."));
    }
}
