package dao.fhe.csl.controller;

import dao.fhe.csl.model.BatchSnapshot;
import dao.fhe.csl.model.Contribution;
import dao.fhe.csl.model.ContributionRequest;
import dao.fhe.csl.service.SettlementCoordinator;
import dao.fhe.csl.service.SettlementException;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/batches")
public class BatchController {

    private final SettlementCoordinator coordinator;

    public BatchController(SettlementCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/open")
    public ResponseEntity<Map<String, Object>> openBatch(@RequestHeader(name = "X-Actor", required = false) String caller) {
        try {
            BatchSnapshot batch = coordinator.openBatch(caller);
            return ResponseEntity.ok(BatchViews.batchInfo(batch));
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/close")
    public ResponseEntity<Map<String, Object>> closeBatch(@RequestHeader(name = "X-Actor", required = false) String caller) {
        try {
            BatchSnapshot batch = coordinator.closeBatch(caller);
            return ResponseEntity.ok(BatchViews.batchInfo(batch));
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/contributions")
    public ResponseEntity<Map<String, Object>> submitContribution(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                                  @Valid @RequestBody ContributionRequest req) {
        try {
            Contribution c = coordinator.submitContribution(caller, req.getCost(), req.getBudget(), req.getHandle());
            return ResponseEntity.ok(BatchViews.contributionInfo(c));
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getBatches() {
        List<BatchSnapshot> batches = coordinator.getBatches();
        List<Map<String, Object>> infos = new ArrayList<>();
        for (BatchSnapshot b : batches) {
            infos.add(BatchViews.batchInfo(b));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalBatches", batches.size());
        response.put("batches", infos);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<Map<String, Object>> getBatch(@PathVariable long batchId) {
        try {
            return ResponseEntity.ok(BatchViews.batchInfo(coordinator.getBatch(batchId)));
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }
}
