package com.chimera.orchestrator.repository;

import com.chimera.orchestrator.model.DeadLetterEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

/**
 * CRUD operations for the dead_letters table.
 */
public interface DeadLetterRepository extends JpaRepository<DeadLetterEntry, String> {

    /** Newest failures first; taskId breaks ties so paging is stable. */
    @Query("SELECT d FROM DeadLetterEntry d ORDER BY d.createdAt DESC, d.taskId DESC")
    List<DeadLetterEntry> findNewestFirst(Pageable page);
}
