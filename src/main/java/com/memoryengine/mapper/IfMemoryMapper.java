package com.memoryengine.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.entity.IfMemoryEntity;
import com.memoryengine.ifmemory.SourceReferenceCodec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the IfMemory domain model and IfMemoryEntity.
 *
 * <p>This is the single place where the JSON columns are read and written. Bindings are
 * stored as an alias -> encoded reference object, preserving insertion order. On read,
 * unprefixed binding values and a blank {@code output_reference} with a legacy
 * {@code output_item_id} both decode as points.
 */
@Mapper
public interface IfMemoryMapper {

    @Mapping(source = "branches", target = "branches", qualifiedByName = "branchesToJson")
    @Mapping(source = "variableBindings", target = "variableAliases", qualifiedByName = "bindingsToJson")
    @Mapping(source = "outputDestination", target = "outputReference", qualifiedByName = "referenceToString")
    @Mapping(target = "outputItemId", ignore = true)
    IfMemoryEntity toEntity(IfMemory ifMemory);

    @Mapping(source = "branches", target = "branches", qualifiedByName = "jsonToBranches")
    @Mapping(source = "variableAliases", target = "variableBindings", qualifiedByName = "jsonToBindings")
    @Mapping(target = "outputDestination", expression = "java(destinationOf(entity))")
    IfMemory toDomain(IfMemoryEntity entity);

    List<IfMemory> toDomainList(List<IfMemoryEntity> entities);

    @Named("branchesToJson")
    default String branchesToJson(List<Branch> branches) {
        return JsonHelper.toJson(branches == null ? List.of() : branches);
    }

    @Named("jsonToBranches")
    default List<Branch> jsonToBranches(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, Branch.class));
    }

    @Named("bindingsToJson")
    default String bindingsToJson(List<VariableBinding> bindings) {
        Map<String, String> aliases = new LinkedHashMap<>();
        if (bindings != null) {
            bindings.forEach(binding ->
                    aliases.put(binding.getAlias(), SourceReferenceCodec.encode(binding.getSource())));
        }
        return JsonHelper.toJson(aliases);
    }

    @Named("jsonToBindings")
    default List<VariableBinding> jsonToBindings(String json) {
        Map<String, String> aliases = JsonHelper.fromJson(json, new TypeReference<LinkedHashMap<String, String>>() {});
        List<VariableBinding> bindings = new ArrayList<>();
        if (aliases != null) {
            aliases.forEach((alias, encoded) ->
                    bindings.add(new VariableBinding(alias, SourceReferenceCodec.decode(encoded))));
        }
        return bindings;
    }

    @Named("referenceToString")
    default String referenceToString(SourceReference reference) {
        return reference == null ? null : SourceReferenceCodec.encode(reference);
    }

    default SourceReference destinationOf(IfMemoryEntity entity) {
        String encoded = entity.getOutputReference();
        if (encoded == null || encoded.isBlank()) {
            encoded = entity.getOutputItemId();
        }
        if (encoded == null || encoded.isBlank()) {
            return null;
        }
        return SourceReferenceCodec.decode(encoded);
    }
}
