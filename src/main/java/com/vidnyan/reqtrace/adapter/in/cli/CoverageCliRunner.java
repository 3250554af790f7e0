package com.vidnyan.reqtrace.adapter.in.cli;

import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.ImplStatus;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.RuleSummary;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.StaleEntry;
import com.vidnyan.reqtrace.application.port.in.CoverageQueryUseCase.StatusReport;
import com.vidnyan.reqtrace.config.ReqTraceProperties;
import com.vidnyan.reqtrace.domain.validation.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * CLI runner printing a coverage report on startup.
 * Runs when reqtrace.cli.enabled is true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoverageCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED = 20;

    private final CoverageQueryUseCase queries;
    private final ReqTraceProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        if (!properties.getCli().isEnabled()) {
            log.debug("CLI report disabled. Set reqtrace.cli.enabled=true.");
            return;
        }

        try {
            StatusReport status = queries.status();
            log.info("═══════════════════════════════════════════════════════════════");
            log.info(" REQTRACE COVERAGE  (snapshot v{})", status.version());
            log.info(" Project: {}", properties.projectRootPath());
            log.info("═══════════════════════════════════════════════════════════════");
            for (ImplStatus impl : status.impls()) {
                printImpl(impl);
            }
            printFindings(queries.validate(null));
        } finally {
            if (properties.getCli().isExitAfterReport()) {
                SpringApplication.exit(context, () -> 0);
            }
        }
    }

    private void printImpl(ImplStatus impl) {
        String key = impl.spec() + "/" + impl.impl();
        log.info("");
        log.info(" {}", key);
        log.info("   Rules:        {}", impl.totalRules());
        log.info("   Implemented:  {} ({})", impl.implementedRules(), formatPercent(impl.implPercent()));
        log.info("   Verified:     {} ({})", impl.verifiedRules(), formatPercent(impl.verifyPercent()));
        log.info("   Units:        {}/{} covered", impl.coveredUnits(), impl.totalUnits());
        log.info("   Stale refs:   {}", impl.staleReferences());

        List<RuleSummary> uncovered = queries.uncovered(key, null);
        if (!uncovered.isEmpty()) {
            log.info("   Uncovered:");
            uncovered.stream().limit(MAX_LISTED).forEach(r -> log.info("     - {} ({})", r.id(), r.location().format()));
            if (uncovered.size() > MAX_LISTED) {
                log.info("     ... and {} more", uncovered.size() - MAX_LISTED);
            }
        }
        List<StaleEntry> stale = queries.stale(key, null);
        stale.stream().limit(MAX_LISTED).forEach(s -> log.info("   Stale: {} at {} (@{} -> @{})",
                s.ruleId(), s.location().format(), s.capturedFingerprint(), s.currentFingerprint()));
    }

    private void printFindings(List<Finding> findings) {
        log.info("───────────────────────────────────────────────────────────────");
        if (findings.isEmpty()) {
            log.info(" No findings.");
            return;
        }
        log.warn(" {} findings:", findings.size());
        for (Finding finding : findings.stream().limit(MAX_LISTED * 2L).toList()) {
            String where = finding.primaryLocation() == null ? "-" : finding.primaryLocation().format();
            log.warn("  [{}] {} {}", finding.kind(), where, finding.message());
        }
    }

    private static String formatPercent(double percent) {
        return String.format(Locale.ROOT, "%.1f%%", percent);
    }
}
