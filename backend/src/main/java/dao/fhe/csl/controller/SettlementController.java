package dao.fhe.csl.controller;

import dao.fhe.csl.model.DecryptionCallbackRequest;
import dao.fhe.csl.model.SettlementRequestSnapshot;
import dao.fhe.csl.model.SettlementResult;
import dao.fhe.csl.service.SettlementCoordinator;
import dao.fhe.csl.service.SettlementException;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/settlements")
public class SettlementController {

    private final SettlementCoordinator coordinator;

    public SettlementController(SettlementCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * POST /api/settlements/batches/{batchId}
     * Starts decryption of a closed batch's aggregate. Returns as soon as the request is recorded.
     */
    @PostMapping("/batches/{batchId}")
    public ResponseEntity<Map<String, Object>> requestSettlement(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                                 @PathVariable long batchId) {
        try {
            SettlementRequestSnapshot request = coordinator.requestSettlement(caller, batchId);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "ACCEPTED");
            response.put("token", request.getToken());
            response.put("stateHash", request.getStateHash());
            response.put("batchId", request.getBatchId());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    /**
     * POST /api/settlements/callback
     * Delivery of a decryption result by the oracle relayer.
     */
    @PostMapping("/callback")
    public ResponseEntity<Map<String, Object>> onDecryptionResult(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                                  @Valid @RequestBody DecryptionCallbackRequest req) {
        try {
            SettlementResult result = coordinator.onDecryptionResult(caller, req.getToken(), req.getCleartext(), req.getProof());
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "FINALIZED");
            response.putAll(BatchViews.resultInfo(result));
            return ResponseEntity.ok(response);
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getSettlements() {
        List<Map<String, Object>> requests = new ArrayList<>();
        for (SettlementRequestSnapshot r : coordinator.getSettlementRequests()) {
            requests.add(BatchViews.requestInfo(r));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalRequests", requests.size());
        response.put("requests", requests);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{token}")
    public ResponseEntity<Map<String, Object>> getSettlement(@PathVariable String token) {
        try {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "SUCCESS");
            response.putAll(BatchViews.requestInfo(coordinator.getSettlementRequest(token)));
            return ResponseEntity.ok(response);
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }
}
