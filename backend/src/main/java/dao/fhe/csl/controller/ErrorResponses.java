package dao.fhe.csl.controller;

import dao.fhe.csl.service.SettlementException;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

final class ErrorResponses {
    private ErrorResponses() {}

    static ResponseEntity<Map<String, Object>> of(SettlementException e) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ERROR");
        response.put("error", e.getKind().name());
        response.put("message", e.getMessage());
        return ResponseEntity.status(e.getKind().httpStatus()).body(response);
    }
}
