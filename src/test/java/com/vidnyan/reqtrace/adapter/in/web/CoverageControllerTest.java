package com.vidnyan.reqtrace.adapter.in.web;

import com.vidnyan.reqtrace.application.service.ReloadController;
import com.vidnyan.reqtrace.config.ReqTraceConfiguration;
import com.vidnyan.reqtrace.support.TestProject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CoverageControllerTest {

    @TempDir
    Path root;

    private TestProject project;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        project = new TestProject(root).withSampleCoverage();
        ReloadController controller = project.reloadController();
        controller.start();
        mvc = MockMvcBuilders
                .standaloneSetup(new CoverageController(project.queries(controller), controller))
                .setControllerAdvice(new RestExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(ReqTraceConfiguration.jsonMapper()))
                .build();
    }

    @AfterEach
    void tearDown() {
        project.close();
    }

    @Test
    void status_ShouldReturnPairTotals() throws Exception {
        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.impls", hasSize(1)))
                .andExpect(jsonPath("$.impls[0].totalRules").value(3))
                .andExpect(jsonPath("$.impls[0].coveredUnits").value(2));
    }

    @Test
    void uncovered_ShouldPassFilters() throws Exception {
        mvc.perform(get("/api/uncovered").param("specImpl", "spec/impl").param("prefix", "db"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value("db.conn"))
                .andExpect(jsonPath("$[0].level").value("MUST"));
    }

    @Test
    void rule_ShouldReturnNotFoundProblem() throws Exception {
        mvc.perform(get("/api/rules/db.none"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not found"))
                .andExpect(jsonPath("$.subject").value("db.none"));
    }

    @Test
    void rule_ShouldReturnReferences() throws Exception {
        mvc.perform(get("/api/rules/db.close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.implRefs", hasSize(1)))
                .andExpect(jsonPath("$.stale", hasSize(1)));
    }

    @Test
    void badArguments_ShouldReturnBadRequest() throws Exception {
        mvc.perform(get("/api/uncovered").param("specImpl", "noslash"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/search"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/search").param("q", "db").param("limit", "many"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/search").param("q", "db").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unmapped_ShouldReturnUnitsAndTree() throws Exception {
        mvc.perform(get("/api/unmapped").param("path", "db.src"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.units", hasSize(1)))
                .andExpect(jsonPath("$.coverage.totalUnits").value(3));
    }

    @Test
    void file_ShouldReturnUnitsWithRuleRefs() throws Exception {
        mvc.perform(get("/api/file").param("path", "db.src"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("db.src"))
                .andExpect(jsonPath("$.units", hasSize(3)))
                .andExpect(jsonPath("$.units[1].ruleRefs[0]").value("db.close"))
                .andExpect(jsonPath("$.units[2].ruleRefs", hasSize(0)));
    }

    @Test
    void file_ShouldReturnNotFoundForUnscannedPath() throws Exception {
        mvc.perform(get("/api/file").param("path", "missing.src"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.subject").value("missing.src"));
    }

    @Test
    void reload_ShouldBumpVersion() throws Exception {
        mvc.perform(post("/api/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2));
        mvc.perform(get("/api/version"))
                .andExpect(jsonPath("$.version").value(2));
    }

    @Test
    void validate_ShouldListFindings() throws Exception {
        mvc.perform(get("/api/validate").param("specImpl", "spec/impl"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("STALE"));
    }
}
