package com.vidnyan.reqtrace.adapter.in.web;

import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.ConfigView;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.FileDetail;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.RuleDetail;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.RuleSummary;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.SearchHit;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.StaleEntry;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.StatusReport;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.UnmappedReport;
import com.vidnyan.reqtrace.application.port.in.ReloadUseCase;
import com.vidnyan.reqtrace.domain.error.RebuildFailureException;
import com.vidnyan.reqtrace.domain.validation.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API over the coverage queries. No logic of its own beyond argument passing.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CoverageController {

    private final CoverageQueryUseCase queries;
    private final ReloadUseCase reloadUseCase;

    @GetMapping("/status")
    public StatusReport status() {
        return queries.status();
    }

    @GetMapping("/uncovered")
    public List<RuleSummary> uncovered(@RequestParam(required = false) String specImpl,
                                       @RequestParam(required = false) String prefix) {
        return queries.uncovered(specImpl, prefix);
    }

    @GetMapping("/untested")
    public List<RuleSummary> untested(@RequestParam(required = false) String specImpl,
                                      @RequestParam(required = false) String prefix) {
        return queries.untested(specImpl, prefix);
    }

    @GetMapping("/stale")
    public List<StaleEntry> stale(@RequestParam(required = false) String specImpl,
                                  @RequestParam(required = false) String prefix) {
        return queries.stale(specImpl, prefix);
    }

    @GetMapping("/unmapped")
    public UnmappedReport unmapped(@RequestParam(required = false) String specImpl,
                                   @RequestParam(required = false) String path) {
        return queries.unmapped(specImpl, path);
    }

    @GetMapping("/file")
    public FileDetail file(@RequestParam("path") String path) {
        return queries.fileDetail(path);
    }

    @GetMapping("/rules/{id}")
    public RuleDetail rule(@PathVariable("id") String id) {
        return queries.ruleDetail(id);
    }

    @GetMapping("/validate")
    public List<Finding> validate(@RequestParam(required = false) String specImpl) {
        return queries.validate(specImpl);
    }

    @GetMapping("/search")
    public List<SearchHit> search(@RequestParam("q") String query,
                                  @RequestParam(defaultValue = "50") int limit) {
        return queries.search(query, limit);
    }

    @GetMapping("/config")
    public ConfigView config() {
        return queries.config();
    }

    @GetMapping("/version")
    public VersionResponse version() {
        return new VersionResponse(queries.version());
    }

    @PostMapping("/reload")
    public VersionResponse reload() throws RebuildFailureException {
        log.info("Reload requested over HTTP");
        return new VersionResponse(reloadUseCase.reload());
    }

    public record VersionResponse(long version) {}
}
