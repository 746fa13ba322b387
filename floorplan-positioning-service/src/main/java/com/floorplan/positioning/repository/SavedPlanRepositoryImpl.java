package com.floorplan.positioning.repository;

import com.floorplan.positioning.config.SavedPlanStoreProperties;
import com.floorplan.positioning.dto.SavedPlan;
import com.floorplan.positioning.exception.PlanPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DynamoDB implementation of the SavedPlanRepository interface.
 *
 * <p>The table is keyed by plan id only. Replacing by file path needs a scan, which is acceptable
 * because a device keeps a handful of saved plans at most.
 */
@Repository
@Profile("!test")
public class SavedPlanRepositoryImpl implements SavedPlanRepository {

    private static final Logger logger = LoggerFactory.getLogger(SavedPlanRepositoryImpl.class);

    /**
     * Most recently opened first; records without a timestamp sort last.
     */
    static final Comparator<SavedPlan> LAST_OPENED_DESCENDING = Comparator.comparing(
            SavedPlan::getLastOpened, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed();

    private final DynamoDbTable<SavedPlan> planTable;
    private final String tableName;

    public SavedPlanRepositoryImpl(
            DynamoDbEnhancedClient enhancedClient,
            SavedPlanStoreProperties storeProperties) {
        this.tableName = storeProperties.getTableName();
        this.planTable = enhancedClient.table(tableName, TableSchema.fromBean(SavedPlan.class));
        logger.info("Initialized SavedPlanRepository with table: {}", tableName);
    }

    @Override
    public List<SavedPlan> findAll() {
        try {
            List<SavedPlan> plans = scanAll().stream()
                    .sorted(LAST_OPENED_DESCENDING)
                    .toList();
            logger.debug("Loaded {} saved plans from table {}", plans.size(), tableName);
            return plans;
        } catch (SdkException e) {
            logger.error("Error listing saved plans from table {}", tableName, e);
            throw new PlanPersistenceException("Failed to list saved plans", e);
        }
    }

    @Override
    public Optional<SavedPlan> findById(String id) {
        validateId(id);
        try {
            return Optional.ofNullable(planTable.getItem(keyOf(id)));
        } catch (SdkException e) {
            logger.error("Error retrieving saved plan {}", id, e);
            throw new PlanPersistenceException("Failed to retrieve saved plan " + id, e);
        }
    }

    @Override
    public SavedPlan save(SavedPlan plan) {
        validateId(plan.getId());
        try {
            removeReplacedPlans(plan);
            planTable.putItem(plan);
            logger.info("Saved plan {} ({})", plan.getId(), plan.getName());
            return plan;
        } catch (SdkException e) {
            logger.error("Error saving plan {}", plan.getId(), e);
            throw new PlanPersistenceException("Failed to save plan " + plan.getId(), e);
        }
    }

    @Override
    public boolean deleteById(String id) {
        validateId(id);
        try {
            SavedPlan deleted = planTable.deleteItem(keyOf(id));
            logger.info("Delete of saved plan {} {}", id, deleted != null ? "succeeded" : "found nothing");
            return deleted != null;
        } catch (SdkException e) {
            logger.error("Error deleting saved plan {}", id, e);
            throw new PlanPersistenceException("Failed to delete saved plan " + id, e);
        }
    }

    /**
     * Deletes records for the same file stored under a different id, so a file is only saved once.
     */
    private void removeReplacedPlans(SavedPlan plan) {
        scanAll().stream()
                .filter(existing -> !Objects.equals(existing.getId(), plan.getId()))
                .filter(existing -> Objects.equals(existing.getFilePath(), plan.getFilePath()))
                .forEach(existing -> {
                    logger.debug("Replacing saved plan {} with {} for file {}",
                            existing.getId(), plan.getId(), plan.getFilePath());
                    planTable.deleteItem(keyOf(existing.getId()));
                });
    }

    private List<SavedPlan> scanAll() {
        return planTable.scan().items().stream().toList();
    }

    private static Key keyOf(String id) {
        return Key.builder().partitionValue(id).build();
    }

    private static void validateId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Saved plan id must not be blank");
        }
    }
}
