package com.quillflow.quillflow_backend.repository;

import com.quillflow.quillflow_backend.model.domain.CostRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface CostRecordRepository extends JpaRepository<CostRecord, UUID> {

    List<CostRecord> findByTaskIdOrderByCreatedAtAsc(UUID taskId);

    // Everything in the current billing period
    List<CostRecord> findByCreatedAtGreaterThanEqual(Instant from);
}
