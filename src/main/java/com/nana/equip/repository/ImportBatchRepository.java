package com.nana.equip.repository;

import com.nana.equip.domain.ImportBatch;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the import batch ledger. One row is written per
 * import attempt and is only ever moved forward from {@code pending}.
 */
public interface ImportBatchRepository {

    /**
     * Inserts a new {@code pending} batch, assigning its id and creation time.
     *
     * @param batch the batch to record
     * @return the same instance with id and createdAt set
     * @throws RepositoryException if the insert fails
     */
    ImportBatch create(ImportBatch batch);

    /**
     * Marks a batch {@code processed} and stamps its completion time.
     *
     * @param batchId       the batch id
     * @param processedRows number of equipment and labor rows written
     * @throws RepositoryException if the batch does not exist or the update fails
     */
    void markProcessed(String batchId, int processedRows);

    /**
     * Marks a batch {@code failed}. The completion time stays empty.
     *
     * @param batchId      the batch id
     * @param errorMessage short description of the abort
     * @throws RepositoryException if the update fails
     */
    void markFailed(String batchId, String errorMessage);

    Optional<ImportBatch> findById(String batchId);

    /** @return the project's batches, newest first */
    List<ImportBatch> findByProject(String projectId);
}
