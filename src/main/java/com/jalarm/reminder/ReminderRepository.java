package com.jalarm.reminder;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReminderRepository extends JpaRepository<Reminder, Reminder.Key> {

    Optional<Reminder> findByOwnerIdAndId(String ownerId, String id);

    boolean existsByOwnerIdAndId(String ownerId, String id);

    List<Reminder> findByOwnerIdAndStatusAndTriggerAtLessThanEqual(
            String ownerId, Reminder.Status status, Instant cutoff);

    Optional<Reminder> findFirstByOwnerIdAndStatusOrderByTriggerAtAsc(String ownerId, Reminder.Status status);

    List<Reminder> findByOwnerIdOrderByTriggerAtAsc(String ownerId);

    List<Reminder> findByOwnerIdAndStatusOrderByTriggerAtAsc(String ownerId, Reminder.Status status);

    long countByOwnerId(String ownerId);

    @Query("SELECT DISTINCT r.ownerId FROM Reminder r WHERE r.status = ?1")
    List<String> findOwnerIdsByStatus(Reminder.Status status);
}
