package dao.fhe.csl.repository;

import dao.fhe.csl.model.SettlementRequest;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySettlementRequestRepository implements SettlementRequestRepository {

    // key: request token; insertion order kept for listings
    private final Map<String, SettlementRequest> requestsByToken = Collections.synchronizedMap(new LinkedHashMap<>());

    // key: batch id -> tokens requested for it
    private final Map<Long, List<String>> tokensByBatchId = new ConcurrentHashMap<>();

    @Override
    public synchronized void save(SettlementRequest request) {
        if (request.getToken() == null || request.getToken().isBlank()) {
            throw new IllegalArgumentException("Settlement request has no token");
        }
        SettlementRequest previous = requestsByToken.put(request.getToken(), request);
        if (previous == null) {
            tokensByBatchId.computeIfAbsent(request.getBatchId(), k -> new ArrayList<>()).add(request.getToken());
        }
    }

    @Override
    public Optional<SettlementRequest> findByToken(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(requestsByToken.get(token));
    }

    @Override
    public synchronized List<SettlementRequest> findByBatchId(long batchId) {
        List<String> tokens = tokensByBatchId.getOrDefault(batchId, List.of());
        List<SettlementRequest> out = new ArrayList<>(tokens.size());
        for (String t : tokens) {
            out.add(requestsByToken.get(t));
        }
        return out;
    }

    @Override
    public List<SettlementRequest> findAll() {
        synchronized (requestsByToken) {
            return new ArrayList<>(requestsByToken.values());
        }
    }
}
