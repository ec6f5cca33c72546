package dao.fhe.csl.controller;

import dao.fhe.csl.model.RegistrySnapshot;
import dao.fhe.csl.service.SettlementCoordinator;
import dao.fhe.csl.service.SettlementException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final SettlementCoordinator coordinator;

    public AdminController(SettlementCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/providers/{provider}")
    public ResponseEntity<Map<String, Object>> authorizeProvider(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                                 @PathVariable String provider) {
        try {
            coordinator.authorizeProvider(caller, provider);
            return registry();
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @DeleteMapping("/providers/{provider}")
    public ResponseEntity<Map<String, Object>> revokeProvider(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                              @PathVariable String provider) {
        try {
            coordinator.revokeProvider(caller, provider);
            return registry();
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> setPaused(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                         @RequestBody PauseRequest req) {
        try {
            coordinator.setPaused(caller, req.paused());
            return registry();
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/cooldown")
    public ResponseEntity<Map<String, Object>> setCooldown(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                           @RequestBody CooldownRequest req) {
        try {
            coordinator.setCooldown(caller, req.seconds());
            return registry();
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/transfer")
    public ResponseEntity<Map<String, Object>> transferAdmin(@RequestHeader(name = "X-Actor", required = false) String caller,
                                                             @RequestBody TransferAdminRequest req) {
        try {
            coordinator.transferAdmin(caller, req.newAdmin());
            return registry();
        } catch (SettlementException e) {
            return ErrorResponses.of(e);
        }
    }

    @GetMapping("/registry")
    public ResponseEntity<Map<String, Object>> registry() {
        RegistrySnapshot snapshot = coordinator.getRegistry();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("admin", snapshot.admin());
        response.put("providers", snapshot.providers());
        response.put("relayers", snapshot.relayers());
        response.put("paused", snapshot.paused());
        response.put("cooldownSeconds", snapshot.cooldownSeconds());
        return ResponseEntity.ok(response);
    }

    public record PauseRequest(boolean paused) {}

    public record CooldownRequest(long seconds) {}

    public record TransferAdminRequest(String newAdmin) {}
}
