package com.example.SmartNews.repository;

import com.example.SmartNews.entity.LearningTask;
import com.example.SmartNews.enums.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LearningTaskRepository extends JpaRepository<LearningTask, String> {

    List<LearningTask> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    List<LearningTask> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, TaskStatus status, Pageable pageable);

    List<LearningTask> findByStatusIn(Collection<TaskStatus> statuses);

    long countByStatusIn(Collection<TaskStatus> statuses);

    List<LearningTask> findByStatusInAndCompletedAtBefore(Collection<TaskStatus> statuses, LocalDateTime cutoff);

    // Row lock so concurrent partial updates of one task serialize instead of losing writes
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM LearningTask t WHERE t.id = :id")
    Optional<LearningTask> findByIdForUpdate(@Param("id") String id);
}
