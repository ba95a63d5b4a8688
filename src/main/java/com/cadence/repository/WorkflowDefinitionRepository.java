package com.cadence.repository;

import com.cadence.model.WorkflowDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for versioned workflow definitions.
 *
 * findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(tenant, workflowId)
 * → the latest version, which is what new enrollments are created against.
 */
public interface WorkflowDefinitionRepository extends JpaRepository<WorkflowDefinition, UUID> {

    Optional<WorkflowDefinition> findFirstByTenantIdAndWorkflowIdOrderByVersionDesc(
            String tenantId, String workflowId);

    Optional<WorkflowDefinition> findByTenantIdAndWorkflowIdAndVersion(
            String tenantId, String workflowId, int version);

    List<WorkflowDefinition> findByTenantIdAndWorkflowId(String tenantId, String workflowId);

    // Latest version of every workflow of a tenant
    @Query("select d from WorkflowDefinition d where d.tenantId = :tenantId and d.version = "
            + "(select max(d2.version) from WorkflowDefinition d2 "
            + "where d2.tenantId = d.tenantId and d2.workflowId = d.workflowId) "
            + "order by d.updatedAt desc")
    List<WorkflowDefinition> findLatestByTenantId(@Param("tenantId") String tenantId);
}
