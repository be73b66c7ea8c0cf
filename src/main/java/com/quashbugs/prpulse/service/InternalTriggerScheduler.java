package com.quashbugs.prpulse.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for single instance deployments. Multi-instance deployments keep this off and call
 * the cron endpoints from one external invoker instead.
 */
@Component
@ConditionalOnProperty(name = "spring.scheduler.internal.enabled", havingValue = "true")
public class InternalTriggerScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InternalTriggerScheduler.class);

    private final NotificationTickService notificationTickService;
    private final TokenRefreshService tokenRefreshService;

    @Autowired
    public InternalTriggerScheduler(NotificationTickService notificationTickService, TokenRefreshService tokenRefreshService) {
        this.notificationTickService = notificationTickService;
        this.tokenRefreshService = tokenRefreshService;
    }

    @Scheduled(cron = "${spring.scheduler.notification-cron:0 * * * * *}", zone = "UTC")
    public void notificationTick() {
        LOGGER.debug("Internal notification trigger fired");
        notificationTickService.runTick();
    }

    @Scheduled(cron = "${spring.scheduler.token-refresh-cron:0 */30 * * * *}", zone = "UTC")
    public void tokenRefresh() {
        LOGGER.debug("Internal token refresh trigger fired");
        tokenRefreshService.refreshExpiringTokens();
    }
}
