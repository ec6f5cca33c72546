package dao.fhe.csl.repository;

import dao.fhe.csl.model.BatchStatus;
import dao.fhe.csl.model.ContributionBatch;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
public class InMemoryBatchRepository implements BatchRepository {

    // key: batch id
    private final Map<Long, ContributionBatch> batchesById = new ConcurrentHashMap<>();

    private final AtomicLong idSeq = new AtomicLong(1);

    @Override
    public long nextId() {
        return idSeq.getAndIncrement();
    }

    @Override
    public synchronized void save(ContributionBatch batch) {
        if (batch.getId() <= 0L) {
            throw new IllegalArgumentException("Batch id must be allocated before save");
        }
        batchesById.put(batch.getId(), batch);
    }

    @Override
    public List<ContributionBatch> findAll() {
        List<ContributionBatch> all = new ArrayList<>(batchesById.values());
        all.sort(Comparator.comparingLong(ContributionBatch::getId));
        return all;
    }

    @Override
    public Optional<ContributionBatch> findById(long id) {
        return Optional.ofNullable(batchesById.get(id));
    }

    @Override
    public Optional<ContributionBatch> findOpen() {
        return batchesById.values().stream()
                .filter(b -> b.getStatus() == BatchStatus.OPEN)
                .findFirst();
    }
}
