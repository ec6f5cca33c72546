package dao.fhe.csl.controller;

import dao.fhe.csl.config.SchedulerProperties;
import dao.fhe.csl.event.EventJournal;
import dao.fhe.csl.event.LedgerEvent;
import dao.fhe.csl.model.BatchSnapshot;
import dao.fhe.csl.model.BatchStatus;
import dao.fhe.csl.model.RegistrySnapshot;
import dao.fhe.csl.model.SettlementRequestSnapshot;
import dao.fhe.csl.model.SettlementStatus;
import dao.fhe.csl.service.DecryptionTask;
import dao.fhe.csl.service.RelayedDecryptionOracle;
import dao.fhe.csl.service.SettlementCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Read-only view of the ledger for operators and the oracle relayer.
 */
@RestController
@RequestMapping("/api/monitor")
public class MonitoringController {

    private final SettlementCoordinator coordinator;
    private final EventJournal journal;
    private final RelayedDecryptionOracle oracle;
    private final SchedulerProperties schedulerProps;

    public MonitoringController(SettlementCoordinator coordinator,
                                EventJournal journal,
                                RelayedDecryptionOracle oracle,
                                SchedulerProperties schedulerProps) {
        this.coordinator = coordinator;
        this.journal = journal;
        this.oracle = oracle;
        this.schedulerProps = schedulerProps;
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        List<BatchSnapshot> batches = coordinator.getBatches();
        List<SettlementRequestSnapshot> requests = coordinator.getSettlementRequests();
        RegistrySnapshot registry = coordinator.getRegistry();

        long openBatches = batches.stream().filter(b -> b.getStatus() == BatchStatus.OPEN).count();
        long settledBatches = batches.stream().filter(BatchSnapshot::isSettled).count();
        int totalContributions = batches.stream().mapToInt(BatchSnapshot::getContributionCount).sum();
        long finalized = requests.stream().filter(r -> r.getStatus() == SettlementStatus.FINALIZED).count();
        long rejected = requests.stream().filter(r -> r.getStatus() == SettlementStatus.REJECTED).count();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("registry", Map.of(
                "paused", registry.paused(),
                "cooldownSeconds", registry.cooldownSeconds(),
                "providers", registry.providers().size()
        ));
        response.put("statistics", Map.of(
                "totalBatches", batches.size(),
                "openBatches", openBatches,
                "settledBatches", settledBatches,
                "totalContributions", totalContributions,
                "settlementRequests", requests.size(),
                "finalizedRequests", finalized,
                "rejectedRequests", rejected,
                "pendingRequests", requests.size() - finalized - rejected,
                "events", journal.size()
        ));
        response.put("schedulers", Map.of(
                "stallMonitor", Map.of(
                        "enabled", schedulerProps.getStallMonitor().isEnabled(),
                        "stallThresholdSeconds", schedulerProps.getStallMonitor().getStallThresholdSeconds()
                )
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/events
     * Full notification journal in emission order.
     */
    @GetMapping("/events")
    public ResponseEntity<Map<String, Object>> getEvents() {
        List<Map<String, Object>> events = new ArrayList<>();
        for (LedgerEvent e : journal.getEvents()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("type", e.type());
            info.put("event", e);
            events.add(info);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalEvents", events.size());
        response.put("events", events);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/decryption-tasks
     * Polled by the oracle relayer.
     */
    @GetMapping("/decryption-tasks")
    public ResponseEntity<Map<String, Object>> getDecryptionTasks() {
        List<DecryptionTask> tasks = oracle.pendingTasks();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalTasks", tasks.size());
        response.put("tasks", tasks);
        return ResponseEntity.ok(response);
    }
}
