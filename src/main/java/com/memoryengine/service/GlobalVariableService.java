package com.memoryengine.service;

import com.memoryengine.domain.enums.GlobalVariableType;
import com.memoryengine.domain.enums.UsageKind;
import com.memoryengine.domain.model.GlobalVariable;
import com.memoryengine.domain.model.GlobalVariableUsage;
import com.memoryengine.domain.model.GlobalVariableValue;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.entity.GlobalVariableEntity;
import com.memoryengine.event.EventPublisherHelper;
import com.memoryengine.exception.BusinessException;
import com.memoryengine.exception.ErrorCode;
import com.memoryengine.exception.ResourceNotFoundException;
import com.memoryengine.ifmemory.LiveValueStore;
import com.memoryengine.mapper.GlobalVariableMapper;
import com.memoryengine.mapper.IfMemoryMapper;
import com.memoryengine.repository.jpa.GlobalVariableJpaRepository;
import com.memoryengine.repository.jpa.IfMemoryJpaRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Global-variable definitions (H2) and their live values (Redis).
 *
 * <p>An enabled variable always has a live record; creating or re-enabling one writes
 * the type default ({@code false} / {@code 0}), disabling or deleting removes it.
 * Renaming rewrites every IF-memory reference from {@code GV:old} to {@code GV:new} and
 * notifies the engine. Deleting a variable, or changing its type, is refused while
 * any IF memory still refers to it.
 */
@Service
public class GlobalVariableService {

    private static final Logger log = LoggerFactory.getLogger(GlobalVariableService.class);

    private final GlobalVariableJpaRepository globalVariableJpaRepository;
    private final IfMemoryJpaRepository ifMemoryJpaRepository;
    private final LiveValueStore liveValueStore;
    private final EventPublisherHelper eventPublisherHelper;

    private final GlobalVariableMapper globalVariableMapper = Mappers.getMapper(GlobalVariableMapper.class);
    private final IfMemoryMapper ifMemoryMapper = Mappers.getMapper(IfMemoryMapper.class);

    public GlobalVariableService(
            GlobalVariableJpaRepository globalVariableJpaRepository,
            IfMemoryJpaRepository ifMemoryJpaRepository,
            LiveValueStore liveValueStore,
            EventPublisherHelper eventPublisherHelper) {
        this.globalVariableJpaRepository = globalVariableJpaRepository;
        this.ifMemoryJpaRepository = ifMemoryJpaRepository;
        this.liveValueStore = liveValueStore;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public List<GlobalVariable> findAll() {
        return globalVariableMapper.toDomainList(globalVariableJpaRepository.findAllByOrderByNameAsc());
    }

    public GlobalVariable getById(UUID id) {
        GlobalVariableEntity entity = globalVariableJpaRepository
                .findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("GlobalVariable", String.valueOf(id)));
        return globalVariableMapper.toDomain(entity);
    }

    /** Live value text, empty for disabled variables or when Redis holds no record. */
    public Optional<String> currentValue(GlobalVariable globalVariable) {
        if (globalVariable.isDisabled()) {
            return Optional.empty();
        }
        return liveValueStore.findGlobalVariable(globalVariable.getName()).map(GlobalVariableValue::getValue);
    }

    public GlobalVariable create(GlobalVariable globalVariable) {
        if (globalVariableJpaRepository.existsByName(globalVariable.getName())) {
            throw nameTaken(globalVariable.getName());
        }
        globalVariable.setId(UUID.randomUUID());
        globalVariable.setCreatedAt(null);

        GlobalVariable saved = save(globalVariable);
        if (!saved.isDisabled()) {
            writeDefault(saved.getName(), saved.getVariableType());
        }
        log.info("Created global variable {} ({})", saved.getName(), saved.getVariableType());
        return saved;
    }

    @Transactional
    public GlobalVariable update(UUID id, GlobalVariable changes) {
        GlobalVariable existing = getById(id);
        String oldName = existing.getName();
        String newName = changes.getName();
        boolean renamed = !oldName.equals(newName);
        boolean retyped = existing.getVariableType() != changes.getVariableType();

        if (renamed && globalVariableJpaRepository.existsByName(newName)) {
            throw nameTaken(newName);
        }
        if (retyped && !findUsages(oldName).isEmpty()) {
            throw new BusinessException(
                    ErrorCode.CONFLICT,
                    "Global variable " + oldName + " is in use; its type cannot change",
                    Map.of("variableType", "Referenced by IF memories"));
        }

        Optional<GlobalVariableValue> live = liveValueStore.findGlobalVariable(oldName);
        GlobalVariable updated = GlobalVariable.builder()
                .id(id)
                .name(newName)
                .variableType(changes.getVariableType())
                .description(changes.getDescription())
                .disabled(changes.isDisabled())
                .createdAt(existing.getCreatedAt())
                .build();
        GlobalVariable saved = save(updated);

        if (renamed) {
            liveValueStore.deleteGlobalVariable(oldName);
        }
        if (saved.isDisabled()) {
            liveValueStore.deleteGlobalVariable(saved.getName());
        } else if (retyped || existing.isDisabled() || live.isEmpty()) {
            writeDefault(saved.getName(), saved.getVariableType());
        } else if (renamed) {
            writeValue(saved.getName(), saved.getVariableType(), live.get().getValue());
        }

        // The live record under the new name must exist before references point at it
        if (renamed) {
            int rewritten = rewriteReferences(oldName, newName);
            log.info("Renamed global variable {} to {}, rewrote {} IF memories", oldName, newName, rewritten);
        }
        return saved;
    }

    public void delete(UUID id) {
        GlobalVariable existing = getById(id);
        List<GlobalVariableUsage> usages = findUsages(existing.getName());
        if (!usages.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.CONFLICT,
                    "Global variable " + existing.getName() + " is still referenced by IF memories",
                    Map.of("usages", usages.stream().map(GlobalVariableUsage::getMemoryName).distinct().toList()));
        }
        globalVariableJpaRepository.deleteById(id);
        liveValueStore.deleteGlobalVariable(existing.getName());
        log.info("Deleted global variable {}", existing.getName());
    }

    public List<GlobalVariableUsage> getUsages(UUID id) {
        return findUsages(getById(id).getName());
    }

    /**
     * Sets the live value. BOOLEAN variables take a boolean, FLOAT variables a finite
     * number; disabled variables reject writes.
     *
     * @return the stored text
     */
    public String setValue(UUID id, Object value) {
        GlobalVariable globalVariable = getById(id);
        if (globalVariable.isDisabled()) {
            throw new BusinessException(
                    ErrorCode.CONFLICT, "Global variable " + globalVariable.getName() + " is disabled");
        }

        String text = toText(globalVariable, value);
        writeValue(globalVariable.getName(), globalVariable.getVariableType(), text);
        log.info("Global variable {} set to {}", globalVariable.getName(), text);
        return text;
    }

    private static String toText(GlobalVariable globalVariable, Object value) {
        if (globalVariable.getVariableType() == GlobalVariableType.BOOLEAN) {
            if (value instanceof Boolean booleanValue) {
                return booleanValue.toString();
            }
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Global variable " + globalVariable.getName() + " is BOOLEAN",
                    Map.of("value", "Must be true or false"));
        }
        if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
            return String.valueOf(number.doubleValue());
        }
        throw new BusinessException(
                ErrorCode.VALIDATION_ERROR,
                "Global variable " + globalVariable.getName() + " is FLOAT",
                Map.of("value", "Must be a finite number"));
    }

    List<GlobalVariableUsage> findUsages(String name) {
        SourceReference reference = SourceReference.globalVariable(name);
        List<GlobalVariableUsage> usages = new ArrayList<>();
        for (IfMemory ifMemory : ifMemoryMapper.toDomainList(ifMemoryJpaRepository.findAllByOrderByNameAsc())) {
            for (VariableBinding binding : ifMemory.getVariableBindings()) {
                if (reference.equals(binding.getSource())) {
                    usages.add(usage(ifMemory, UsageKind.INPUT, binding.getAlias()));
                }
            }
            if (reference.equals(ifMemory.getOutputDestination())) {
                usages.add(usage(ifMemory, UsageKind.OUTPUT, null));
            }
        }
        return usages;
    }

    private int rewriteReferences(String oldName, String newName) {
        SourceReference from = SourceReference.globalVariable(oldName);
        SourceReference to = SourceReference.globalVariable(newName);
        int rewritten = 0;

        for (IfMemory ifMemory : ifMemoryMapper.toDomainList(ifMemoryJpaRepository.findAllByOrderByNameAsc())) {
            boolean changed = false;
            for (VariableBinding binding : ifMemory.getVariableBindings()) {
                if (from.equals(binding.getSource())) {
                    binding.setSource(to);
                    changed = true;
                }
            }
            if (from.equals(ifMemory.getOutputDestination())) {
                ifMemory.setOutputDestination(to);
                changed = true;
            }
            if (changed) {
                IfMemory saved = ifMemoryMapper.toDomain(ifMemoryJpaRepository.save(ifMemoryMapper.toEntity(ifMemory)));
                eventPublisherHelper.publishIfMemoryUpdated(this, saved);
                rewritten++;
            }
        }
        return rewritten;
    }

    private static GlobalVariableUsage usage(IfMemory ifMemory, UsageKind kind, String alias) {
        return GlobalVariableUsage.builder()
                .memoryId(ifMemory.getId())
                .memoryName(ifMemory.getName())
                .usage(kind)
                .alias(alias)
                .build();
    }

    private GlobalVariable save(GlobalVariable globalVariable) {
        GlobalVariableEntity saved = globalVariableJpaRepository.save(globalVariableMapper.toEntity(globalVariable));
        return globalVariableMapper.toDomain(saved);
    }

    private void writeDefault(String name, GlobalVariableType variableType) {
        writeValue(name, variableType, GlobalVariableValue.defaultValueFor(variableType));
    }

    private void writeValue(String name, GlobalVariableType variableType, String value) {
        liveValueStore.saveGlobalVariable(GlobalVariableValue.builder()
                .name(name)
                .variableType(variableType)
                .value(value)
                .updatedAtEpochMs(System.currentTimeMillis())
                .build());
    }

    private static BusinessException nameTaken(String name) {
        return new BusinessException(
                ErrorCode.CONFLICT,
                "A global variable named " + name + " already exists",
                Map.of("name", "Must be unique"));
    }
}
