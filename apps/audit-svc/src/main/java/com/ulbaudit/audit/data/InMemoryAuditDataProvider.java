package com.ulbaudit.audit.data;

import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.PartitionRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAuditDataProvider implements AuditDataProvider {

    private volatile Map<String, AuditEntity> entities = Collections.emptyMap();
    private final Map<String, Map<String, List<PartitionRow>>> partitions = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    /**
     * Replaces the entity register. Entity order is kept as given.
     */
    public void replaceEntities(List<AuditEntity> newEntities) {
        Map<String, AuditEntity> byId = new LinkedHashMap<>();
        for (AuditEntity entity : newEntities) {
            byId.putIfAbsent(entity.id(), entity);
        }
        entities = Collections.unmodifiableMap(byId);
        loaded = true;
    }

    public void savePartition(String partition, List<PartitionRow> rows) {
        Map<String, List<PartitionRow>> byEntity = rows.stream()
                .collect(Collectors.groupingBy(PartitionRow::entityId, LinkedHashMap::new,
                        Collectors.collectingAndThen(Collectors.toList(), List::copyOf)));
        partitions.put(partition, Collections.unmodifiableMap(byEntity));
    }

    public void clear() {
        entities = Collections.emptyMap();
        partitions.clear();
        loaded = false;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public int entityCount() {
        return entities.size();
    }

    public List<String> partitionEntityIds(String partition) {
        Map<String, List<PartitionRow>> byEntity = partitions.get(partition);
        return byEntity == null ? List.of() : new ArrayList<>(byEntity.keySet());
    }

    public List<String> partitionNames() {
        return partitions.keySet().stream().sorted().toList();
    }

    @Override
    public List<String> getAllEntityIds() {
        if (!loaded) {
            throw new DataProviderUnavailableException("no entity data has been loaded");
        }
        return new ArrayList<>(entities.keySet());
    }

    @Override
    public Optional<AuditEntity> findEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    @Override
    public List<PartitionRow> findRows(String partition, String entityId) {
        if (partition == null) {
            return List.of();
        }
        Map<String, List<PartitionRow>> byEntity = partitions.get(partition);
        if (byEntity == null) {
            return List.of();
        }
        return byEntity.getOrDefault(entityId, List.of());
    }

    @Override
    public boolean hasPartition(String partition) {
        return partition != null && partitions.containsKey(partition);
    }
}
