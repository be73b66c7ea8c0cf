package com.quashbugs.prpulse.controller;

import com.quashbugs.prpulse.dto.ResponseDTO;
import com.quashbugs.prpulse.dto.TickSummaryDTO;
import com.quashbugs.prpulse.dto.TokenRefreshSummaryDTO;
import com.quashbugs.prpulse.service.NotificationTickService;
import com.quashbugs.prpulse.service.TokenRefreshService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry points for the external cron invoker. Guarded by the shared cron secret.
 */
@RestController
@RequestMapping("/api/cron")
public class CronController {

    private final NotificationTickService notificationTickService;
    private final TokenRefreshService tokenRefreshService;

    @Autowired
    public CronController(NotificationTickService notificationTickService, TokenRefreshService tokenRefreshService) {
        this.notificationTickService = notificationTickService;
        this.tokenRefreshService = tokenRefreshService;
    }

    @PostMapping("/notifications")
    public ResponseEntity<ResponseDTO> runNotifications() {
        try {
            TickSummaryDTO summary = notificationTickService.runTick();
            if (!summary.isSuccess()) {
                return ResponseEntity.internalServerError().body(new ResponseDTO(false, "Notification tick failed", summary));
            }
            return ResponseEntity.ok(new ResponseDTO(true, "Notification tick completed", summary));
        } catch (Exception e) {
            return ResponseEntity.internalServerError().body(new ResponseDTO(false, "Error running notification tick", e.getMessage()));
        }
    }

    @PostMapping("/token-refresh")
    public ResponseEntity<ResponseDTO> refreshTokens() {
        try {
            TokenRefreshSummaryDTO summary = tokenRefreshService.refreshExpiringTokens();
            return ResponseEntity.ok(new ResponseDTO(true, "Token refresh completed", summary));
        } catch (Exception e) {
            return ResponseEntity.internalServerError().body(new ResponseDTO(false, "Error refreshing tokens", e.getMessage()));
        }
    }
}
