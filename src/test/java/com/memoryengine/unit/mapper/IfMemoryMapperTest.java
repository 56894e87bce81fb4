package com.memoryengine.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.memoryengine.domain.enums.OutputType;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.entity.IfMemoryEntity;
import com.memoryengine.mapper.IfMemoryMapper;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class IfMemoryMapperTest {

    private final IfMemoryMapper ifMemoryMapper = Mappers.getMapper(IfMemoryMapper.class);

    @Test
    @DisplayName("Bindings are stored as an alias object with prefixed references, in order")
    void bindingsAsAliasObject() {
        IfMemory ifMemory = IfMemory.builder()
                .id(UUID.randomUUID())
                .name("Mixer")
                .outputType(OutputType.ANALOG)
                .outputDestination(SourceReference.globalVariable("speed"))
                .variableBindings(List.of(
                        new VariableBinding("z", SourceReference.point("p-1")),
                        new VariableBinding("a", SourceReference.globalVariable("mode"))))
                .branches(List.of(Branch.builder().id("b0").order(0).condition("[z] > 1").outputValue(3).build()))
                .build();

        IfMemoryEntity entity = ifMemoryMapper.toEntity(ifMemory);

        assertThat(entity.getVariableAliases()).isEqualTo("{\"z\":\"P:p-1\",\"a\":\"GV:mode\"}");
        assertThat(entity.getOutputReference()).isEqualTo("GV:speed");
        assertThat(entity.getOutputItemId()).isNull();
        assertThat(entity.getBranches()).contains("\"condition\":\"[z] > 1\"");
    }

    @Test
    @DisplayName("Legacy rows: unprefixed aliases and output_item_id decode as points")
    void legacyRow() {
        IfMemoryEntity entity = IfMemoryEntity.builder()
                .id(UUID.randomUUID())
                .name("Old")
                .branches("[{\"id\":\"b0\",\"order\":0,\"condition\":\"[v1] > 2\",\"outputValue\":1.0,"
                        + "\"hysteresis\":0.0}]")
                .variableAliases("{\"v1\":\"7c2d-legacy\"}")
                .outputItemId("9e1f-relay")
                .outputType(OutputType.DIGITAL)
                .interval(2)
                .build();

        IfMemory ifMemory = ifMemoryMapper.toDomain(entity);

        assertThat(ifMemory.getOutputDestination()).isEqualTo(SourceReference.point("9e1f-relay"));
        assertThat(ifMemory.getVariableBindings())
                .containsExactly(new VariableBinding("v1", SourceReference.point("7c2d-legacy")));
        assertThat(ifMemory.getBranches()).singleElement()
                .satisfies(branch -> assertThat(branch.getCondition()).isEqualTo("[v1] > 2"));
    }

    @Test
    @DisplayName("output_reference wins over the legacy column")
    void referenceWinsOverLegacyColumn() {
        IfMemoryEntity entity = IfMemoryEntity.builder()
                .id(UUID.randomUUID())
                .name("Migrated")
                .outputReference("GV:alarm")
                .outputItemId("9e1f-relay")
                .outputType(OutputType.DIGITAL)
                .interval(1)
                .build();

        assertThat(ifMemoryMapper.toDomain(entity).getOutputDestination())
                .isEqualTo(SourceReference.globalVariable("alarm"));
    }

    @Test
    @DisplayName("Missing JSON columns map to empty lists")
    void emptyColumns() {
        IfMemoryEntity entity = IfMemoryEntity.builder()
                .id(UUID.randomUUID())
                .name("Bare")
                .outputType(OutputType.DIGITAL)
                .interval(1)
                .build();

        IfMemory ifMemory = ifMemoryMapper.toDomain(entity);

        assertThat(ifMemory.getBranches()).isEmpty();
        assertThat(ifMemory.getVariableBindings()).isEmpty();
        assertThat(ifMemory.getOutputDestination()).isNull();
    }
}
