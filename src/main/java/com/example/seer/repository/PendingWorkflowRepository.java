package com.example.seer.repository;

import com.example.seer.domain.PendingWorkflow;
import com.example.seer.domain.WorkflowApprovalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PendingWorkflowRepository extends JpaRepository<PendingWorkflow, String> {

    List<PendingWorkflow> findByStatusOrderByCreatedAtDesc(WorkflowApprovalStatus status);

    Optional<PendingWorkflow> findByIncidentId(String incidentId);
}
