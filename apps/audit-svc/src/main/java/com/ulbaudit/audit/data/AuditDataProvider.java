package com.ulbaudit.audit.data;

import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.PartitionRow;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to already materialized entity data. Implementations throw
 * {@link DataProviderUnavailableException} only when no data can be served at all.
 */
public interface AuditDataProvider {

    List<String> getAllEntityIds();

    Optional<AuditEntity> findEntity(String entityId);

    /**
     * Rows of one entity in one partition, empty when the partition or the entity's rows are absent.
     */
    List<PartitionRow> findRows(String partition, String entityId);

    boolean hasPartition(String partition);
}
