package dao.fhe.csl.repository;

import dao.fhe.csl.model.ContributionBatch;

import java.util.List;
import java.util.Optional;

public interface BatchRepository {

    /** Next id to allocate; ids start at 1 and never repeat. */
    long nextId();

    void save(ContributionBatch batch);

    List<ContributionBatch> findAll();

    Optional<ContributionBatch> findById(long id);

    /** The batch currently accepting contributions, if any. */
    Optional<ContributionBatch> findOpen();
}
