package com.docclassifier.shared.repository;

import com.docclassifier.shared.model.ClassificationJob;
import com.docclassifier.shared.model.ErrorCode;
import com.docclassifier.shared.model.JobState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ClassificationJob entities.
 * Every state transition is a conditional update; the returned row count tells the caller
 * whether it won the transition.
 */
@Repository
public interface ClassificationJobRepository extends JpaRepository<ClassificationJob, Long> {

    Optional<ClassificationJob> findByJobUuid(UUID jobUuid);

    List<ClassificationJob> findByBatchUuidOrderByBatchPositionAsc(UUID batchUuid);

    /**
     * Current members of a batch: members replaced by a retry are left out.
     */
    List<ClassificationJob> findByBatchUuidAndRetriedAsIsNullOrderByBatchPositionAsc(UUID batchUuid);

    long countByStatus(JobState status);

    /**
     * Oldest job ids in the given state, for re-dispatch.
     */
    @Query("SELECT j.jobUuid FROM ClassificationJob j WHERE j.status = :status ORDER BY j.createdAt ASC")
    List<UUID> findJobUuidsByStatus(@Param("status") JobState status, Pageable pageable);

    @Query("SELECT j.jobUuid FROM ClassificationJob j WHERE j.status = :running AND j.leaseExpiresAt < :now")
    List<UUID> findExpiredLeases(@Param("running") JobState running, @Param("now") Instant now);

    @Query("SELECT j FROM ClassificationJob j WHERE j.createdAt < :cutoff AND j.status IN :states")
    List<ClassificationJob> findCreatedBeforeWithStatusIn(@Param("cutoff") Instant cutoff,
                                                         @Param("states") Collection<JobState> states);

    /**
     * PENDING -> RUNNING. Increments the attempt count and starts a lease.
     * @return 1 if this caller claimed the job, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.status = :running, j.attemptCount = j.attemptCount + 1, "
            + "j.leaseExpiresAt = :leaseExpiresAt, j.startedAt = :now, j.updatedAt = :now "
            + "WHERE j.jobUuid = :jobUuid AND j.status = :pending")
    int claim(@Param("jobUuid") UUID jobUuid,
              @Param("pending") JobState pending,
              @Param("running") JobState running,
              @Param("leaseExpiresAt") Instant leaseExpiresAt,
              @Param("now") Instant now);

    /**
     * RUNNING -> SUCCESS, only for the attempt that holds the claim.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.status = :success, j.resultJson = :resultJson, "
            + "j.documentType = :documentType, j.confidence = :confidence, j.mediaType = :mediaType, "
            + "j.leaseExpiresAt = null, j.completedAt = :now, j.updatedAt = :now "
            + "WHERE j.jobUuid = :jobUuid AND j.status = :running AND j.attemptCount = :attempt")
    int complete(@Param("jobUuid") UUID jobUuid,
                 @Param("attempt") int attempt,
                 @Param("running") JobState running,
                 @Param("success") JobState success,
                 @Param("resultJson") String resultJson,
                 @Param("documentType") String documentType,
                 @Param("confidence") Double confidence,
                 @Param("mediaType") String mediaType,
                 @Param("now") Instant now);

    /**
     * RUNNING -> FAILURE, only for the attempt that holds the claim.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.status = :failure, j.errorCode = :errorCode, "
            + "j.errorMessage = :errorMessage, j.mediaType = :mediaType, j.leaseExpiresAt = null, "
            + "j.completedAt = :now, j.updatedAt = :now "
            + "WHERE j.jobUuid = :jobUuid AND j.status = :running AND j.attemptCount = :attempt")
    int fail(@Param("jobUuid") UUID jobUuid,
             @Param("attempt") int attempt,
             @Param("running") JobState running,
             @Param("failure") JobState failure,
             @Param("errorCode") ErrorCode errorCode,
             @Param("errorMessage") String errorMessage,
             @Param("mediaType") String mediaType,
             @Param("now") Instant now);

    /**
     * RUNNING -> FAILURE for a job whose lease has run out.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.status = :failure, j.errorCode = :errorCode, "
            + "j.errorMessage = :errorMessage, j.leaseExpiresAt = null, j.completedAt = :now, j.updatedAt = :now "
            + "WHERE j.jobUuid = :jobUuid AND j.status = :running AND j.leaseExpiresAt < :now")
    int failIfLeaseExpired(@Param("jobUuid") UUID jobUuid,
                           @Param("running") JobState running,
                           @Param("failure") JobState failure,
                           @Param("errorCode") ErrorCode errorCode,
                           @Param("errorMessage") String errorMessage,
                           @Param("now") Instant now);

    /**
     * PENDING -> FAILURE for every still-pending member of a batch.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.status = :failure, j.errorCode = :errorCode, "
            + "j.errorMessage = :errorMessage, j.completedAt = :now, j.updatedAt = :now "
            + "WHERE j.batchUuid = :batchUuid AND j.status = :pending")
    int failPendingInBatch(@Param("batchUuid") UUID batchUuid,
                           @Param("pending") JobState pending,
                           @Param("failure") JobState failure,
                           @Param("errorCode") ErrorCode errorCode,
                           @Param("errorMessage") String errorMessage,
                           @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.storagePath = null WHERE j.jobUuid = :jobUuid")
    int clearStoragePath(@Param("jobUuid") UUID jobUuid);

    /**
     * Links a failed member to the job retrying it. Only one retry can win.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ClassificationJob j SET j.retriedAs = :retriedAs, j.updatedAt = :now "
            + "WHERE j.jobUuid = :jobUuid AND j.status = :failure AND j.retriedAs IS NULL")
    int markRetried(@Param("jobUuid") UUID jobUuid,
                    @Param("failure") JobState failure,
                    @Param("retriedAs") UUID retriedAs,
                    @Param("now") Instant now);
}
