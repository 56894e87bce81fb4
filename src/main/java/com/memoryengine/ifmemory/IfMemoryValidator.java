package com.memoryengine.ifmemory;

import com.memoryengine.domain.enums.GlobalVariableType;
import com.memoryengine.domain.enums.OutputType;
import com.memoryengine.domain.enums.PointItemType;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.PointSample;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.entity.GlobalVariableEntity;
import com.memoryengine.exception.BusinessException;
import com.memoryengine.repository.jpa.GlobalVariableJpaRepository;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Save-time validation of an IF memory definition.
 *
 * <p>Collects every violation before failing, keyed by field path
 * ({@code branches[2].condition}, {@code variableBindings[0].alias}, ...), and throws a
 * single {@link BusinessException} carrying them as details. Indexes refer to the
 * branch list after order normalization and to the binding list as submitted.
 * A definition that passes never produces configuration errors at evaluation time,
 * though live sources may still disappear later.
 */
@Component
public class IfMemoryValidator {

    static final Pattern ALIAS_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final IfMemoryEngineConfig ifMemoryEngineConfig;
    private final ConditionEvaluator conditionEvaluator;
    private final GlobalVariableJpaRepository globalVariableJpaRepository;
    private final LiveValueStore liveValueStore;
    private final BoundedStoreAccess boundedStoreAccess;

    public IfMemoryValidator(
            IfMemoryEngineConfig ifMemoryEngineConfig,
            ConditionEvaluator conditionEvaluator,
            GlobalVariableJpaRepository globalVariableJpaRepository,
            LiveValueStore liveValueStore,
            BoundedStoreAccess boundedStoreAccess) {
        this.ifMemoryEngineConfig = ifMemoryEngineConfig;
        this.conditionEvaluator = conditionEvaluator;
        this.globalVariableJpaRepository = globalVariableJpaRepository;
        this.liveValueStore = liveValueStore;
        this.boundedStoreAccess = boundedStoreAccess;
    }

    /** @throws BusinessException with one detail entry per violation */
    public void validate(IfMemory ifMemory) {
        Map<String, Object> errors = new LinkedHashMap<>();

        if (ifMemory.getName() == null || ifMemory.getName().isBlank()) {
            errors.put("name", "Name must not be empty");
        }
        if (ifMemory.getInterval() < 1) {
            errors.put("interval", "Interval must be at least 1");
        }
        if (!Double.isFinite(ifMemory.getDefaultValue())) {
            errors.put("defaultValue", "Default value must be a finite number");
        }

        SourceReference destination = ifMemory.getOutputDestination();
        validateDestination(destination, ifMemory.getOutputType(), errors);

        Set<String> destinationAliases = new HashSet<>();
        Set<String> boundAliases =
                validateBindings(ifMemory.getVariableBindings(), destination, destinationAliases, errors);
        validateBranches(ifMemory.sortedBranches(), boundAliases, destinationAliases, errors);

        if (!errors.isEmpty()) {
            throw new BusinessException("Invalid IF memory configuration", errors);
        }
    }

    private Set<String> validateBindings(
            List<VariableBinding> bindings,
            SourceReference destination,
            Set<String> destinationAliases,
            Map<String, Object> errors) {
        Set<String> aliases = new HashSet<>();
        if (bindings == null) {
            return aliases;
        }

        for (int i = 0; i < bindings.size(); i++) {
            VariableBinding binding = bindings.get(i);
            String path = "variableBindings[" + i + "]";
            String alias = binding.getAlias();

            if (alias == null || alias.isBlank()) {
                errors.put(path + ".alias", "Alias must not be empty");
            } else if (!ALIAS_PATTERN.matcher(alias).matches()) {
                errors.put(path + ".alias", "Alias '" + alias + "' is not a valid identifier");
            } else if (!aliases.add(alias)) {
                errors.put(path + ".alias", "Duplicate alias '" + alias + "'");
            }

            SourceReference source = binding.getSource();
            if (source == null) {
                errors.put(path + ".source", "Source must not be empty");
                continue;
            }
            if (source.equals(destination)) {
                errors.put(path + ".source", "The output destination cannot also be an input");
                if (alias != null) {
                    destinationAliases.add(alias);
                }
                continue;
            }
            checkSourceExists(source).ifPresent(message -> errors.put(path + ".source", message));
        }
        return aliases;
    }

    private void validateBranches(
            List<Branch> branches,
            Set<String> boundAliases,
            Set<String> destinationAliases,
            Map<String, Object> errors) {
        int maxBranches = ifMemoryEngineConfig.getMaxBranches();
        if (branches.size() > maxBranches) {
            errors.put("branches", "At most " + maxBranches + " branches are allowed");
        }

        int maxLength = ifMemoryEngineConfig.getMaxConditionLength();
        Set<String> branchIds = new HashSet<>();
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            String path = "branches[" + i + "]";
            String condition = branch.getCondition();

            // Reorder and remove address branches by id
            if (branch.getId() != null && !branchIds.add(branch.getId())) {
                errors.put(path + ".id", "Duplicate branch id '" + branch.getId() + "'");
            }

            if (condition == null || condition.isBlank()) {
                errors.put(path + ".condition", "Condition must not be empty");
            } else if (condition.length() > maxLength) {
                errors.put(path + ".condition", "Condition must be at most " + maxLength + " characters");
            } else {
                Optional<String> problem = conditionEvaluator.validate(condition, boundAliases);
                if (problem.isPresent()) {
                    errors.put(path + ".condition", problem.get());
                } else {
                    conditionEvaluator.referencedAliases(condition).stream()
                            .filter(destinationAliases::contains)
                            .findFirst()
                            .ifPresent(alias -> errors.put(
                                    path + ".condition",
                                    "Alias '" + alias + "' is bound to the output destination"));
                }
            }

            double hysteresis = branch.getHysteresis();
            if (!Double.isFinite(hysteresis) || hysteresis < 0) {
                errors.put(path + ".hysteresis", "Hysteresis must be a finite number >= 0");
            }
            if (!Double.isFinite(branch.getOutputValue())) {
                errors.put(path + ".outputValue", "Output value must be a finite number");
            }
        }
    }

    private void validateDestination(SourceReference destination, OutputType outputType, Map<String, Object> errors) {
        if (destination == null) {
            errors.put("outputDestination", "Output destination must not be empty");
            return;
        }
        if (outputType == null) {
            errors.put("outputType", "Output type must not be empty");
            return;
        }

        if (destination.isPoint()) {
            PointItemType required =
                    outputType == OutputType.DIGITAL ? PointItemType.DIGITAL_OUTPUT : PointItemType.ANALOG_OUTPUT;
            lookUpPoint(destination.getLocator(), errors, "outputDestination").ifPresent(sample -> {
                if (sample.getItemType() != required) {
                    errors.put(
                            "outputDestination",
                            "Point " + destination.getLocator() + " is " + sample.getItemType() + ", a " + outputType
                                    + " output needs " + required);
                }
            });
            return;
        }

        Optional<GlobalVariableEntity> variable = globalVariableJpaRepository.findByName(destination.getLocator());
        if (variable.isEmpty()) {
            errors.put("outputDestination", "Global variable " + destination.getLocator() + " does not exist");
        } else if (variable.get().isDisabled()) {
            errors.put("outputDestination", "Global variable " + destination.getLocator() + " is disabled");
        } else if (outputType == OutputType.ANALOG && variable.get().getVariableType() != GlobalVariableType.FLOAT) {
            errors.put(
                    "outputDestination",
                    "Global variable " + destination.getLocator() + " is BOOLEAN, an ANALOG output needs FLOAT");
        }
    }

    private Optional<String> checkSourceExists(SourceReference source) {
        if (source.isPoint()) {
            Map<String, Object> pointErrors = new LinkedHashMap<>();
            lookUpPoint(source.getLocator(), pointErrors, "source");
            return Optional.ofNullable((String) pointErrors.get("source"));
        }

        Optional<GlobalVariableEntity> variable = globalVariableJpaRepository.findByName(source.getLocator());
        if (variable.isEmpty()) {
            return Optional.of("Global variable " + source.getLocator() + " does not exist");
        }
        if (variable.get().isDisabled()) {
            return Optional.of("Global variable " + source.getLocator() + " is disabled");
        }
        return Optional.empty();
    }

    private Optional<PointSample> lookUpPoint(String pointId, Map<String, Object> errors, String key) {
        Optional<PointSample> sample;
        try {
            sample = boundedStoreAccess.read("read point " + pointId, () -> liveValueStore.findPoint(pointId));
        } catch (RuntimeException e) {
            errors.put(key, "Point " + pointId + " could not be verified: " + e.getMessage());
            return Optional.empty();
        }
        if (sample.isEmpty()) {
            errors.put(key, "Point " + pointId + " does not exist");
        }
        return sample;
    }
}
