package com.elssolution.motormonitor.web;

import com.elssolution.motormonitor.alerts.AlertService;
import com.elssolution.motormonitor.service.StatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class StatusController {

    private final AlertService alerts;
    private final StatusService status;

    public StatusController(AlertService alerts, StatusService status) {
        this.alerts = alerts;
        this.status = status;
    }

    @GetMapping("/api/system-status")
    public StatusService.SystemStatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/alerts")
    public AlertService.Board getAlerts() {
        return alerts.board();
    }

    @GetMapping("/alerts/deck")
    public List<AlertService.Episode> getAlertDeck(@RequestParam(name = "limit", defaultValue = "10") int limit) {
        return alerts.deck(limit);
    }
}
