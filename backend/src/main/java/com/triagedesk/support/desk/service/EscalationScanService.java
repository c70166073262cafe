package com.triagedesk.support.desk.service;

import com.triagedesk.support.common.api.DeskException;
import com.triagedesk.support.common.concurrent.SingleFlight;
import com.triagedesk.support.desk.model.ItemStatus;
import com.triagedesk.support.desk.model.Priority;
import com.triagedesk.support.desk.model.WorkItem;
import com.triagedesk.support.desk.repo.ScanLockRepository;
import com.triagedesk.support.desk.repo.WorkItemRepository;
import com.triagedesk.support.desk.service.sla.SlaPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Periodic escalation pass plus the read-only at-risk report.
 *
 * A scan runs three independent queries in a fixed order (urgent unassigned, SLA breach, stuck) and escalates
 * every hit through {@link EscalationService}, one transaction per item. An item hit by several triggers is
 * escalated once per trigger and may climb more than one rung in a single pass.
 */
@Service
public class EscalationScanService {

    private static final Logger log = LoggerFactory.getLogger(EscalationScanService.class);

    static final String SCAN_KEY = "escalation_scan";

    private final WorkItemRepository workItemRepository;
    private final EscalationService escalationService;
    private final ScanLockRepository scanLockRepository;
    private final SlaPolicy slaPolicy;
    private final Clock clock;

    private final SingleFlight<ScanResult> singleFlight = new SingleFlight<>();

    private final Counter escalatedTotal;
    private final Counter failedTotal;
    private final Timer scanDuration;

    public EscalationScanService(
            WorkItemRepository workItemRepository,
            EscalationService escalationService,
            ScanLockRepository scanLockRepository,
            SlaPolicy slaPolicy,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.workItemRepository = workItemRepository;
        this.escalationService = escalationService;
        this.scanLockRepository = scanLockRepository;
        this.slaPolicy = slaPolicy;
        this.clock = clock;

        this.escalatedTotal = Counter.builder("triagedesk.escalation.escalated_total")
                .description("Escalations performed by scans")
                .register(meterRegistry);
        this.failedTotal = Counter.builder("triagedesk.escalation.failed_total")
                .description("Per-item escalation failures during scans")
                .register(meterRegistry);
        this.scanDuration = Timer.builder("triagedesk.escalation.scan.duration")
                .description("Duration of escalation scans")
                .register(meterRegistry);
    }

    /**
     * Overlapping calls collapse into the one already running and share its result.
     */
    public ScanResult scan() {
        return singleFlight.run(SCAN_KEY, () -> scanLockRepository.runExclusive(SCAN_KEY, this::runScan)
                .orElseGet(ScanResult::skippedRun));
    }

    private ScanResult runScan() {
        Timer.Sample sample = Timer.start();
        try {
            Instant now = Instant.now(clock);
            var failures = new ArrayList<ScanResult.Failure>();

            var urgentUnassigned = escalateAll(
                    workItemRepository.listUrgentUnassignedNew(),
                    item -> item.priority() == Priority.URGENT && !item.isAssigned()
                            && item.status() == ItemStatus.NEW,
                    EscalationTrigger.UNASSIGNED_URGENT, failures);
            var slaBreach = escalateAll(
                    workItemRepository.listActive(true),
                    item -> item.status().isActive() && slaPolicy.breach(item, now),
                    EscalationTrigger.SLA_BREACH, failures);
            var stuck = escalateAll(
                    workItemRepository.listActive(false),
                    item -> item.status().isActive() && slaPolicy.stuck(item, now),
                    EscalationTrigger.STUCK, failures);

            var result = new ScanResult(urgentUnassigned, slaBreach, stuck, failures, false);
            escalatedTotal.increment(result.totalEscalated());
            failedTotal.increment(failures.size());
            log.info("escalation_scan urgent_unassigned={} sla_breach={} stuck={} failures={}",
                    urgentUnassigned.size(), slaBreach.size(), stuck.size(), failures.size());
            return result;
        } finally {
            sample.stop(scanDuration);
        }
    }

    private List<String> escalateAll(
            List<WorkItem> items,
            Predicate<WorkItem> matches,
            EscalationTrigger trigger,
            List<ScanResult.Failure> failures
    ) {
        var escalated = new ArrayList<String>();
        for (var item : items) {
            if (!matches.test(item)) continue;
            try {
                // the row may have moved on since it was listed; re-check under its lock
                if (escalationService.escalateIf(item.id(), trigger.reason(), matches).isPresent()) {
                    escalated.add(item.id());
                }
            } catch (DeskException e) {
                log.warn("escalation_failed workItemId={} trigger={} error={}", item.id(), trigger.reason(), e.code());
                failures.add(new ScanResult.Failure(item.id(), trigger, e.code()));
            }
        }
        return escalated;
    }

    /**
     * Active items without a first response that are close to their SLA or have sat in their status for over
     * half the stuck threshold. Never writes.
     */
    public AtRiskReport atRisk() {
        Instant now = Instant.now(clock);
        var approaching = new ArrayList<AtRiskReport.ApproachingSla>();
        var stale = new ArrayList<AtRiskReport.GettingStale>();

        for (var item : workItemRepository.listActive(true)) {
            if (slaPolicy.approachingSla(item, now)) {
                approaching.add(new AtRiskReport.ApproachingSla(
                        item.id(),
                        item.subject(),
                        item.priority().code(),
                        round2(slaPolicy.slaHoursRemaining(item, now))
                ));
            }
            if (slaPolicy.gettingStale(item, now)) {
                stale.add(new AtRiskReport.GettingStale(
                        item.id(),
                        item.subject(),
                        item.status().code(),
                        item.priority().code(),
                        round2(slaPolicy.hoursInStatus(item, now))
                ));
            }
        }
        return new AtRiskReport(approaching, stale);
    }

    private static double round2(double v) {
        return Math.round(v * 100d) / 100d;
    }
}
