package com.phillippitts.mcpanalytics.presentation.controller;

import com.phillippitts.mcpanalytics.domain.AnalyticsSummary;
import com.phillippitts.mcpanalytics.domain.ImportDelta;
import com.phillippitts.mcpanalytics.domain.ImportResult;
import com.phillippitts.mcpanalytics.domain.ToolUsageReport;
import com.phillippitts.mcpanalytics.service.analytics.TelemetryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read views over the collected analytics and the import of externally kept totals.
 * Invalid imports surface as {@code InvalidImportException} and are mapped by the global handler.
 */
@RestController
@RequestMapping("/analytics")
class AnalyticsController {

    static final String IMPORT_MESSAGE = "Analytics imported successfully";

    private final TelemetryService telemetry;

    AnalyticsController(TelemetryService telemetry) {
        this.telemetry = telemetry;
    }

    @GetMapping
    ResponseEntity<AnalyticsSummary> summary() {
        return ResponseEntity.ok(telemetry.summarize());
    }

    @GetMapping("/tools")
    ResponseEntity<ToolUsageReport> tools() {
        return ResponseEntity.ok(telemetry.recentToolUsage());
    }

    @PostMapping("/import")
    ResponseEntity<ImportResponse> importTotals(@RequestBody(required = false) ImportDelta delta) {
        ImportResult result = telemetry.importDelta(delta);
        return ResponseEntity.ok(new ImportResponse(IMPORT_MESSAGE, result));
    }

    record ImportResponse(String message, ImportResult currentStats) {}
}
