package com.memoryengine.service;

import com.memoryengine.domain.model.BindingSnapshot;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.ConditionResult;
import com.memoryengine.domain.model.EvaluationPreview;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.InstanceStatus;
import com.memoryengine.domain.model.Scalar;
import com.memoryengine.entity.IfMemoryEntity;
import com.memoryengine.event.EventPublisherHelper;
import com.memoryengine.exception.BusinessException;
import com.memoryengine.exception.ErrorCode;
import com.memoryengine.exception.ResourceNotFoundException;
import com.memoryengine.ifmemory.ConditionEvaluator;
import com.memoryengine.ifmemory.IfMemoryEngine;
import com.memoryengine.ifmemory.IfMemoryEngineConfig;
import com.memoryengine.ifmemory.IfMemoryValidator;
import com.memoryengine.mapper.IfMemoryMapper;
import com.memoryengine.repository.jpa.IfMemoryJpaRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Configuration-store operations on IF memories.
 *
 * <p>Every write normalizes branch orders to 0..n-1 (stable on the submitted order
 * values), gives new branches an id, validates the whole definition, persists it and
 * publishes an {@code IfMemoryChangedEvent} so the engine swaps in the new definition
 * between cycles.
 */
@Service
public class IfMemoryService {

    private static final Logger log = LoggerFactory.getLogger(IfMemoryService.class);

    private final IfMemoryJpaRepository ifMemoryJpaRepository;
    private final IfMemoryValidator ifMemoryValidator;
    private final IfMemoryEngine ifMemoryEngine;
    private final IfMemoryEngineConfig ifMemoryEngineConfig;
    private final ConditionEvaluator conditionEvaluator;
    private final EventPublisherHelper eventPublisherHelper;

    private final IfMemoryMapper ifMemoryMapper = Mappers.getMapper(IfMemoryMapper.class);

    public IfMemoryService(
            IfMemoryJpaRepository ifMemoryJpaRepository,
            IfMemoryValidator ifMemoryValidator,
            IfMemoryEngine ifMemoryEngine,
            IfMemoryEngineConfig ifMemoryEngineConfig,
            ConditionEvaluator conditionEvaluator,
            EventPublisherHelper eventPublisherHelper) {
        this.ifMemoryJpaRepository = ifMemoryJpaRepository;
        this.ifMemoryValidator = ifMemoryValidator;
        this.ifMemoryEngine = ifMemoryEngine;
        this.ifMemoryEngineConfig = ifMemoryEngineConfig;
        this.conditionEvaluator = conditionEvaluator;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public List<IfMemory> findAll() {
        return ifMemoryMapper.toDomainList(ifMemoryJpaRepository.findAllByOrderByNameAsc());
    }

    public IfMemory getById(UUID id) {
        IfMemoryEntity entity = ifMemoryJpaRepository
                .findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("IfMemory", String.valueOf(id)));
        return ifMemoryMapper.toDomain(entity);
    }

    public IfMemory create(IfMemory ifMemory) {
        ifMemory.setId(UUID.randomUUID());
        ifMemory.setCreatedAt(null);
        normalizeBranches(ifMemory);
        ifMemoryValidator.validate(ifMemory);

        IfMemory saved = save(ifMemory);
        log.info(
                "Created IF memory {} ({}) with {} branches",
                saved.getId(),
                saved.getName(),
                saved.getBranches().size());
        eventPublisherHelper.publishIfMemoryCreated(this, saved);
        return saved;
    }

    /** Replaces the whole definition; branch ids supplied by the client are kept. */
    public IfMemory update(UUID id, IfMemory ifMemory) {
        IfMemory existing = getById(id);
        ifMemory.setId(id);
        ifMemory.setCreatedAt(existing.getCreatedAt());
        normalizeBranches(ifMemory);
        ifMemoryValidator.validate(ifMemory);

        IfMemory saved = save(ifMemory);
        log.info("Updated IF memory {} ({})", saved.getId(), saved.getName());
        eventPublisherHelper.publishIfMemoryUpdated(this, saved);
        return saved;
    }

    public void delete(UUID id) {
        if (!ifMemoryJpaRepository.existsById(id)) {
            throw new ResourceNotFoundException("IfMemory", String.valueOf(id));
        }
        ifMemoryJpaRepository.deleteById(id);
        log.info("Deleted IF memory {}", id);
        eventPublisherHelper.publishIfMemoryDeleted(this, id);
    }

    /**
     * Disabling stops evaluation and discards runtime state but keeps the configuration.
     * Enabling re-validates, since referenced sources may have changed meanwhile.
     */
    public IfMemory setDisabled(UUID id, boolean disabled) {
        IfMemory ifMemory = getById(id);
        if (ifMemory.isDisabled() == disabled) {
            return ifMemory;
        }
        ifMemory.setDisabled(disabled);
        if (!disabled) {
            ifMemoryValidator.validate(ifMemory);
        }

        IfMemory saved = save(ifMemory);
        log.info("IF memory {} {}", id, disabled ? "disabled" : "enabled");
        eventPublisherHelper.publishIfMemoryUpdated(this, saved);
        return saved;
    }

    /**
     * Adds one branch at {@code position} (0-based, clamped), or at the end when
     * {@code position} is null.
     */
    public IfMemory addBranch(UUID id, Branch branch, Integer position) {
        IfMemory ifMemory = getById(id);
        List<Branch> branches = new ArrayList<>(ifMemory.sortedBranches());

        int maxBranches = ifMemoryEngineConfig.getMaxBranches();
        if (branches.size() >= maxBranches) {
            throw new BusinessException(
                    "IF memory already has " + branches.size() + " branches",
                    Map.of("branches", "At most " + maxBranches + " branches are allowed"));
        }

        branch.setId(null);
        int index = position == null ? branches.size() : Math.max(0, Math.min(position, branches.size()));
        branches.add(index, branch);
        ifMemory.setBranches(renumber(branches));
        ifMemoryValidator.validate(ifMemory);

        IfMemory saved = save(ifMemory);
        log.info("Added branch at position {} to IF memory {}", index, id);
        eventPublisherHelper.publishIfMemoryUpdated(this, saved);
        return saved;
    }

    public IfMemory removeBranch(UUID id, String branchId) {
        IfMemory ifMemory = getById(id);
        List<Branch> branches = new ArrayList<>(ifMemory.sortedBranches());
        boolean removed = branches.removeIf(branch -> branchId.equals(branch.getId()));
        if (!removed) {
            throw new ResourceNotFoundException("Branch", branchId);
        }
        ifMemory.setBranches(renumber(branches));

        IfMemory saved = save(ifMemory);
        log.info("Removed branch {} from IF memory {}", branchId, id);
        eventPublisherHelper.publishIfMemoryUpdated(this, saved);
        return saved;
    }

    /** {@code branchIds} must list every branch of the IF memory exactly once. */
    public IfMemory reorderBranches(UUID id, List<String> branchIds) {
        IfMemory ifMemory = getById(id);
        Map<String, Branch> byId = new LinkedHashMap<>();
        ifMemory.sortedBranches().forEach(branch -> byId.put(branch.getId(), branch));

        Set<String> requested = new HashSet<>(branchIds);
        boolean permutation = branchIds.size() == byId.size() && byId.keySet().equals(requested);
        if (!permutation) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Reorder must list every branch id exactly once",
                    Map.of("branchIds", "Expected a permutation of " + byId.keySet()));
        }

        List<Branch> reordered = new ArrayList<>();
        branchIds.forEach(branchId -> reordered.add(byId.get(branchId)));
        ifMemory.setBranches(renumber(reordered));

        IfMemory saved = save(ifMemory);
        log.info("Reordered branches of IF memory {}", id);
        eventPublisherHelper.publishIfMemoryUpdated(this, saved);
        return saved;
    }

    public InstanceStatus getStatus(UUID id) {
        return ifMemoryEngine.getStatus(getById(id));
    }

    public EvaluationPreview preview(UUID id) {
        return ifMemoryEngine.preview(getById(id));
    }

    /**
     * Dry-run evaluation of a single condition with operator-supplied values, through the
     * same evaluator the engine uses. Values must be booleans or numbers.
     */
    public ConditionResult testCondition(String condition, Map<String, Object> values) {
        Map<String, Scalar> scalars = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((alias, value) -> scalars.put(alias, toScalar(alias, value)));
        }
        return conditionEvaluator.evaluate(condition, BindingSnapshot.of(scalars));
    }

    private static Scalar toScalar(String alias, Object value) {
        if (value instanceof Boolean booleanValue) {
            return Scalar.bool(booleanValue);
        }
        if (value instanceof Number number) {
            return Scalar.number(number.doubleValue());
        }
        throw new IllegalArgumentException("Value of alias '" + alias + "' must be a boolean or a number");
    }

    private IfMemory save(IfMemory ifMemory) {
        IfMemoryEntity saved = ifMemoryJpaRepository.save(ifMemoryMapper.toEntity(ifMemory));
        return ifMemoryMapper.toDomain(saved);
    }

    private static void normalizeBranches(IfMemory ifMemory) {
        List<Branch> branches =
                ifMemory.getBranches() == null ? new ArrayList<>() : new ArrayList<>(ifMemory.getBranches());
        branches.sort(Comparator.comparingInt(Branch::getOrder));
        ifMemory.setBranches(renumber(branches));
        if (ifMemory.getVariableBindings() == null) {
            ifMemory.setVariableBindings(new ArrayList<>());
        }
    }

    /** Assigns contiguous orders following list position and ids to branches that lack one. */
    private static List<Branch> renumber(List<Branch> branches) {
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            branch.setOrder(i);
            if (branch.getId() == null || branch.getId().isBlank()) {
                branch.setId(UUID.randomUUID().toString());
            }
        }
        return branches;
    }
}
