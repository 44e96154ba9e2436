package com.jalarm.execution;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ExecutionRepository extends JpaRepository<ExecutionRecord, UUID> {

    List<ExecutionRecord> findByOwnerIdOrderByExecutedAtDesc(String ownerId, Pageable pageable);

    List<ExecutionRecord> findByOwnerIdAndScheduleIdOrderByExecutedAtDesc(
            String ownerId, String scheduleId, Pageable pageable);

    long countByOwnerIdAndScheduleId(String ownerId, String scheduleId);

    long deleteByOwnerIdAndScheduleId(String ownerId, String scheduleId);

    long deleteByOwnerIdAndExecutedAtBefore(String ownerId, Instant cutoff);

    long deleteByExecutedAtBefore(Instant cutoff);
}
