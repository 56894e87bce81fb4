package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.OutputType;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Domain model of an IF memory: IF / ELSE IF / ELSE logic over bound live values.
 *
 * <p>Each cycle the engine resolves {@code variableBindings}, walks {@code branches}
 * by ascending order and writes the selected branch's output value (or
 * {@code defaultValue} when none matches) to {@code outputDestination}.
 *
 * <p>The engine never evaluates a mutable instance shared with the service layer:
 * it installs a {@link #snapshot()} so that a cycle always sees one complete definition.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class IfMemory {

    private UUID id;
    private String name;
    private String description;

    @Builder.Default
    private List<Branch> branches = new ArrayList<>();

    @Builder.Default
    private List<VariableBinding> variableBindings = new ArrayList<>();

    private double defaultValue;

    private SourceReference outputDestination;

    @Builder.Default
    private OutputType outputType = OutputType.DIGITAL;

    /** Evaluation period in seconds. */
    @Builder.Default
    private int interval = 1;

    private boolean disabled;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /** Branches sorted by evaluation priority. */
    public List<Branch> sortedBranches() {
        if (branches == null) {
            return List.of();
        }
        return branches.stream()
                .sorted(Comparator.comparingInt(Branch::getOrder))
                .toList();
    }

    /**
     * Deep copy with unmodifiable collections, used as the engine's view of this
     * definition. Branches come out sorted by order.
     */
    public IfMemory snapshot() {
        List<Branch> branchCopies = sortedBranches().stream()
                .map(branch -> branch.toBuilder().build())
                .toList();
        List<VariableBinding> bindingCopies = variableBindings == null
                ? List.of()
                : variableBindings.stream()
                        .map(binding -> new VariableBinding(binding.getAlias(), binding.getSource()))
                        .toList();
        return toBuilder()
                .branches(branchCopies)
                .variableBindings(bindingCopies)
                .build();
    }

    /**
     * True if branches or bindings differ from {@code other}. Such changes invalidate
     * the engine's hysteresis state; edits to default value, destination or interval do not.
     */
    public boolean isStructurallyDifferentFrom(IfMemory other) {
        if (other == null) {
            return true;
        }
        return !Objects.equals(sortedBranches(), other.sortedBranches())
                || !Objects.equals(bindingsOrEmpty(), other.bindingsOrEmpty());
    }

    private List<VariableBinding> bindingsOrEmpty() {
        return variableBindings == null ? List.of() : variableBindings;
    }
}
