package com.docclassifier.shared.repository;

import com.docclassifier.shared.model.BatchJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BatchJobRepository extends JpaRepository<BatchJob, Long> {

    Optional<BatchJob> findByBatchUuid(UUID batchUuid);

    /**
     * Deletes batches older than the cutoff that no longer have member jobs.
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM BatchJob b WHERE b.createdAt < :cutoff AND NOT EXISTS "
            + "(SELECT j.id FROM ClassificationJob j WHERE j.batchUuid = b.batchUuid)")
    int deleteEmptyBatchesCreatedBefore(@Param("cutoff") Instant cutoff);
}
