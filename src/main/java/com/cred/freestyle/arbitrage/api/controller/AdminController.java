package com.cred.freestyle.arbitrage.api.controller;

import com.cred.freestyle.arbitrage.infrastructure.scheduler.AlertDispatchScheduler;
import com.cred.freestyle.arbitrage.security.SecurityUtils;
import com.cred.freestyle.arbitrage.service.alert.AlertScanService.ScanOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints.
 *
 * @author Arbitrage Team
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final AlertDispatchScheduler alertDispatchScheduler;

    public AdminController(AlertDispatchScheduler alertDispatchScheduler) {
        this.alertDispatchScheduler = alertDispatchScheduler;
    }

    /**
     * Scan every due rule now and wait for the results.
     *
     * @return Number of scans per outcome
     */
    @PostMapping("/alerts/scan")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<ScanOutcome, Long>> triggerScan() {
        logger.info("Alert scan requested by {}", SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(alertDispatchScheduler.triggerScanNow());
    }
}
