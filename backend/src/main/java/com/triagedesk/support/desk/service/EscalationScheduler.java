package com.triagedesk.support.desk.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.escalation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    private final EscalationScanService scanService;

    public EscalationScheduler(EscalationScanService scanService) {
        this.scanService = scanService;
    }

    @Scheduled(
            initialDelayString = "${app.escalation.scan-initial-delay-ms:30000}",
            fixedDelayString = "${app.escalation.scan-interval-ms:900000}"
    )
    public void scanAndEscalate() {
        try {
            var result = scanService.scan();
            if (result.skipped()) {
                log.debug("escalation_scan_skipped reason=lock_held");
                return;
            }
            var risk = scanService.atRisk();
            if (!risk.approachingSla().isEmpty() || !risk.gettingStale().isEmpty()) {
                log.info("at_risk approaching_sla={} getting_stale={}",
                        risk.approachingSla().size(), risk.gettingStale().size());
            }
        } catch (Exception e) {
            log.warn("escalation_scan_failed", e);
        }
    }
}
