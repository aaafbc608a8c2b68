package com.example.seer.domain;

import com.example.seer.domain.converter.AnomalyResultConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Approval gate between anomaly detection and automated remediation.
 * One per incident; terminal once approved or rejected.
 */
@Entity
@Table(name = "pending_workflows", indexes = {
        @Index(name = "idx_workflow_status", columnList = "status"),
        @Index(name = "idx_workflow_incident", columnList = "incident_id", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingWorkflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "incident_id", nullable = false)
    private String incidentId;

    @Convert(converter = AnomalyResultConverter.class)
    @Column(length = 4096, nullable = false)
    private AnomalyResult anomaly;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private WorkflowApprovalStatus status = WorkflowApprovalStatus.PENDING_APPROVAL;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pending_workflow_actions", joinColumns = @JoinColumn(name = "workflow_id"))
    @OrderColumn(name = "action_order")
    @Column(name = "action")
    @Builder.Default
    private List<String> actions = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "approval_reason", length = 1024)
    private String approvalReason;

    @Column(name = "rejection_reason", length = 1024)
    private String rejectionReason;

    @Column(name = "responded_by")
    private String respondedBy;

    @Version
    private Long version;
}
