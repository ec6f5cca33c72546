package dao.fhe.csl.repository;

import dao.fhe.csl.model.SettlementRequest;

import java.util.List;
import java.util.Optional;

public interface SettlementRequestRepository {

    void save(SettlementRequest request);

    Optional<SettlementRequest> findByToken(String token);

    List<SettlementRequest> findByBatchId(long batchId);

    List<SettlementRequest> findAll();
}
