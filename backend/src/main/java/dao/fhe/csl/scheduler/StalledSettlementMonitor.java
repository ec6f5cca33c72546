package dao.fhe.csl.scheduler;

import dao.fhe.csl.config.SchedulerProperties;
import dao.fhe.csl.model.SettlementRequestSnapshot;
import dao.fhe.csl.model.SettlementStatus;
import dao.fhe.csl.service.SettlementCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports settlement requests still waiting for their decryption result.
 * A stalled request is not an error and is never touched here; the caller may trigger a new
 * settlement for the batch, which gets its own token.
 */
@Slf4j
@Component
public class StalledSettlementMonitor {

    private final SettlementCoordinator coordinator;
    private final SchedulerProperties schedulerProps;
    private final Clock clock;

    public StalledSettlementMonitor(SettlementCoordinator coordinator,
                                    SchedulerProperties schedulerProps,
                                    Clock clock) {
        this.coordinator = coordinator;
        this.schedulerProps = schedulerProps;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${scheduler.stall-monitor.check-interval-ms:30000}")
    public void reportStalledSettlements() {
        if (!schedulerProps.getStallMonitor().isEnabled()) {
            return;
        }
        long now = clock.instant().getEpochSecond();
        for (SettlementRequestSnapshot r : findStalled(now)) {
            log.warn("Settlement stalled: token={}, batchId={}, waitingSeconds={}",
                    r.getToken(), r.getBatchId(), now - r.getRequestedAt());
        }
    }

    public List<SettlementRequestSnapshot> findStalled(long now) {
        long threshold = schedulerProps.getStallMonitor().getStallThresholdSeconds();
        return coordinator.getSettlementRequests().stream()
                .filter(r -> r.getStatus() == SettlementStatus.REQUESTED)
                .filter(r -> now - r.getRequestedAt() >= threshold)
                .collect(Collectors.toList());
    }
}
