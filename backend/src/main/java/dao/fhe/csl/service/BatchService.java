package dao.fhe.csl.service;

import dao.fhe.csl.event.BatchClosedEvent;
import dao.fhe.csl.event.BatchOpenedEvent;
import dao.fhe.csl.event.ContributionRecordedEvent;
import dao.fhe.csl.event.EventJournal;
import dao.fhe.csl.model.*;
import dao.fhe.csl.repository.BatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Lifecycle of contribution batches. At most one batch is open at any time; contributions are
 * appended only to the open batch and get contiguous indices 0, 1, 2, ...
 * <p>
 * Each operation validates everything it needs before touching the batch.
 */
@Slf4j
@Service
public class BatchService {

    private final BatchRepository batchRepository;
    private final AggregationService aggregationService;
    private final EventJournal journal;

    public BatchService(BatchRepository batchRepository,
                        AggregationService aggregationService,
                        EventJournal journal) {
        this.batchRepository = batchRepository;
        this.aggregationService = aggregationService;
        this.journal = journal;
    }

    public ContributionBatch openBatch(String actor, long now) {
        batchRepository.findOpen().ifPresent(open -> {
            throw new SettlementException(ErrorKind.BATCH_ALREADY_OPEN, "Batch " + open.getId() + " is still open");
        });

        ContributionBatch batch = new ContributionBatch();
        batch.setId(batchRepository.nextId());
        batch.setStatus(BatchStatus.OPEN);
        batch.setOpenedAt(now);
        batchRepository.save(batch);

        journal.append(new BatchOpenedEvent(batch.getId(), actor, now));
        return batch;
    }

    public ContributionBatch closeBatch(String actor, long now) {
        ContributionBatch batch = requireOpen();

        batch.setStatus(BatchStatus.CLOSED);
        batch.setClosedAt(now);
        batchRepository.save(batch);

        journal.append(new BatchClosedEvent(batch.getId(), batch.getContributionCount(), actor, now));
        return batch;
    }

    public Contribution submitContribution(String provider, long now, long cost, long budget, CiphertextHandle handle) {
        if (cost < 0 || budget < 0) {
            throw new SettlementException(ErrorKind.INVALID_INPUT, "Cost and budget must not be negative");
        }
        if (handle == null) {
            throw new SettlementException(ErrorKind.INVALID_INPUT, "Ciphertext handle is required");
        }
        ContributionBatch batch = requireOpen();

        long newTotalCost;
        long newTotalBudget;
        try {
            newTotalCost = Math.addExact(batch.getTotalCost(), cost);
            newTotalBudget = Math.addExact(batch.getTotalBudget(), budget);
        } catch (ArithmeticException e) {
            throw new SettlementException(ErrorKind.INVALID_INPUT, "Batch totals would overflow", e);
        }
        CiphertextHandle newAggregate = aggregationService.accumulate(batch.getRunningAggregate(), handle);
        Contribution contribution = new Contribution(
                batch.getId(), batch.getContributionCount(), provider, handle, cost, budget, now);

        batch.getContributions().add(contribution);
        batch.setTotalCost(newTotalCost);
        batch.setTotalBudget(newTotalBudget);
        batch.setRunningAggregate(newAggregate);
        batchRepository.save(batch);

        journal.append(new ContributionRecordedEvent(
                batch.getId(), contribution.getIndex(), provider, handle.toHex(), cost, budget, now));
        return contribution;
    }

    public List<ContributionBatch> getBatches() {
        return batchRepository.findAll();
    }

    public ContributionBatch getBatch(long batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new SettlementException(ErrorKind.BATCH_NOT_FOUND, "Batch not found: " + batchId));
    }

    private ContributionBatch requireOpen() {
        return batchRepository.findOpen()
                .orElseThrow(() -> new SettlementException(ErrorKind.BATCH_NOT_OPEN, "No batch is open"));
    }
}
