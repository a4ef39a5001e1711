package com.credvault.api.controller;

import com.credvault.api.dto.DiagnosticsReport;
import com.credvault.api.service.DiagnosticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class DiagnosticsController {

    private final DiagnosticsService diagnosticsService;

    /**
     * Store health and configuration report. Always answers 200.
     */
    @GetMapping("/test")
    public DiagnosticsReport testDatabase() {
        return diagnosticsService.runDiagnostics();
    }
}
