package com.example.seer.repository;

import com.example.seer.domain.WorkflowExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecution, String> {

    List<WorkflowExecution> findByIncidentIdOrderByStartedAtDesc(String incidentId);

    List<WorkflowExecution> findByWorkflowId(String workflowId);
}
