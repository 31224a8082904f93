package com.cred.freestyle.rewards.repository;

import com.cred.freestyle.rewards.domain.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, String> {

    Optional<Task> findByTaskCode(String taskCode);
}
