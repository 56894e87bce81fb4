package com.memoryengine.ifmemory;

import com.memoryengine.domain.model.BindingSnapshot;
import com.memoryengine.domain.model.Scalar;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.exception.SourceResolutionException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the alias -> value environment for one evaluation cycle.
 *
 * <p>All-or-nothing: the first binding that fails to resolve aborts the snapshot with
 * a {@link SourceResolutionException} naming the alias. Callers never receive a
 * partially filled environment.
 */
@Component
public class VariableBindingTable {

    private final SourceReferenceResolver sourceReferenceResolver;

    public VariableBindingTable(SourceReferenceResolver sourceReferenceResolver) {
        this.sourceReferenceResolver = sourceReferenceResolver;
    }

    public BindingSnapshot snapshot(List<VariableBinding> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            return BindingSnapshot.empty();
        }

        Map<String, Scalar> values = new LinkedHashMap<>();
        for (VariableBinding binding : bindings) {
            try {
                values.put(binding.getAlias(), sourceReferenceResolver.resolve(binding.getSource()));
            } catch (SourceResolutionException e) {
                throw e.forAlias(binding.getAlias());
            }
        }
        return BindingSnapshot.of(values);
    }
}
