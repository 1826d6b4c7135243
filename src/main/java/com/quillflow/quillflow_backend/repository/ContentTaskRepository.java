package com.quillflow.quillflow_backend.repository;

import com.quillflow.quillflow_backend.model.domain.ContentTask;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ContentTaskRepository extends JpaRepository<ContentTask, UUID> {

    // Newest first, used by the task list endpoint
    List<ContentTask> findTop100ByOrderByCreatedAtDesc();

    // Non-terminal tasks nobody holds a live lease on; candidates for the recovery scan
    @Query("select t from ContentTask t where t.status in :statuses " +
           "and (t.leaseExpiresAt is null or t.leaseExpiresAt < :now) order by t.createdAt asc")
    List<ContentTask> findRecoverable(@Param("statuses") Collection<TaskStatus> statuses,
                                      @Param("now") Instant now);

    /**
     * Atomically takes the lease on a non-terminal task whose previous lease expired.
     * Returns 1 for the single winner when several instances race for the same task.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update ContentTask t set t.leaseOwner = :owner, t.leaseExpiresAt = :expiresAt, " +
           "t.updatedAt = :now, t.version = t.version + 1 " +
           "where t.id = :id and t.status in :statuses " +
           "and (t.leaseExpiresAt is null or t.leaseExpiresAt < :now)")
    int claimLease(@Param("id") UUID id,
                   @Param("owner") String owner,
                   @Param("now") Instant now,
                   @Param("expiresAt") Instant expiresAt,
                   @Param("statuses") Collection<TaskStatus> statuses);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update ContentTask t set t.cancelRequested = true, t.updatedAt = :now, t.version = t.version + 1 " +
           "where t.id = :id and t.status in :statuses")
    int requestCancel(@Param("id") UUID id,
                      @Param("now") Instant now,
                      @Param("statuses") Collection<TaskStatus> statuses);

    // Cancels a task that no worker has picked up yet
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update ContentTask t set t.status = :cancelled, t.completedAt = :now, t.updatedAt = :now, " +
           "t.leaseOwner = null, t.leaseExpiresAt = null, t.version = t.version + 1 " +
           "where t.id = :id and t.status = :pending and (t.leaseExpiresAt is null or t.leaseExpiresAt < :now)")
    int cancelUnclaimed(@Param("id") UUID id,
                        @Param("now") Instant now,
                        @Param("pending") TaskStatus pending,
                        @Param("cancelled") TaskStatus cancelled);
}
