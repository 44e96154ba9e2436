package com.jalarm.recurring;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecurringScheduleRepository extends JpaRepository<RecurringSchedule, RecurringSchedule.Key> {

    Optional<RecurringSchedule> findByOwnerIdAndId(String ownerId, String id);

    List<RecurringSchedule> findByOwnerId(String ownerId);

    List<RecurringSchedule> findByOwnerIdAndEnabledTrueAndNextRunAtLessThanEqual(String ownerId, Instant cutoff);

    Optional<RecurringSchedule> findFirstByOwnerIdAndEnabledTrueAndNextRunAtNotNullOrderByNextRunAtAsc(String ownerId);

    @Query("SELECT DISTINCT s.ownerId FROM RecurringSchedule s WHERE s.enabled = true AND s.nextRunAt IS NOT NULL")
    List<String> findOwnerIdsWithEnabledSchedules();
}
