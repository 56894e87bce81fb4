package com.memoryengine.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.memoryengine.domain.enums.OutputType;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.ConditionResult;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.entity.IfMemoryEntity;
import com.memoryengine.event.EventPublisherHelper;
import com.memoryengine.exception.BusinessException;
import com.memoryengine.exception.ErrorCode;
import com.memoryengine.exception.ResourceNotFoundException;
import com.memoryengine.ifmemory.IfMemoryEngine;
import com.memoryengine.ifmemory.IfMemoryEngineConfig;
import com.memoryengine.ifmemory.IfMemoryValidator;
import com.memoryengine.ifmemory.SpelConditionEvaluator;
import com.memoryengine.mapper.IfMemoryMapper;
import com.memoryengine.repository.jpa.IfMemoryJpaRepository;
import com.memoryengine.service.IfMemoryService;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IfMemoryServiceTest {

    private static final UUID MEMORY_ID = UUID.fromString("0b7e4d2c-5a1f-4c3e-8f9a-1d2c3b4a5e6f");

    @Mock
    private IfMemoryJpaRepository ifMemoryJpaRepository;

    @Mock
    private IfMemoryValidator ifMemoryValidator;

    @Mock
    private IfMemoryEngine ifMemoryEngine;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private final IfMemoryMapper ifMemoryMapper = Mappers.getMapper(IfMemoryMapper.class);

    private IfMemoryService ifMemoryService;

    @BeforeEach
    void setUp() {
        ifMemoryService = new IfMemoryService(
                ifMemoryJpaRepository,
                ifMemoryValidator,
                ifMemoryEngine,
                new IfMemoryEngineConfig(),
                new SpelConditionEvaluator(),
                eventPublisherHelper);
    }

    private static IfMemory memory(Branch... branches) {
        return IfMemory.builder()
                .id(MEMORY_ID)
                .name("Pump")
                .interval(5)
                .outputType(OutputType.DIGITAL)
                .outputDestination(SourceReference.point("relay"))
                .variableBindings(new ArrayList<>(List.of(new VariableBinding("v1", SourceReference.point("temp")))))
                .branches(new ArrayList<>(List.of(branches)))
                .build();
    }

    private static Branch branch(String id, int order, String condition) {
        return Branch.builder().id(id).order(order).condition(condition).build();
    }

    private void givenStored(IfMemory ifMemory) {
        when(ifMemoryJpaRepository.findById(MEMORY_ID)).thenReturn(Optional.of(ifMemoryMapper.toEntity(ifMemory)));
    }

    private void givenSaveEchoes() {
        when(ifMemoryJpaRepository.save(any(IfMemoryEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Nested
    @DisplayName("Create and update")
    class CreateAndUpdate {

        @Test
        @DisplayName("Create assigns an id, normalizes branch orders and publishes")
        void create() {
            givenSaveEchoes();
            IfMemory request = memory(branch(null, 7, "[v1] > 10"), branch(null, 3, "[v1] > 20"));
            request.setId(null);

            IfMemory created = ifMemoryService.create(request);

            assertThat(created.getId()).isNotNull();
            assertThat(created.getBranches()).extracting(Branch::getOrder).containsExactly(0, 1);
            assertThat(created.getBranches()).extracting(Branch::getCondition)
                    .containsExactly("[v1] > 20", "[v1] > 10");
            assertThat(created.getBranches()).allSatisfy(branch -> assertThat(branch.getId()).isNotBlank());
            verify(ifMemoryValidator).validate(any(IfMemory.class));
            verify(eventPublisherHelper).publishIfMemoryCreated(eq(ifMemoryService), any(IfMemory.class));
        }

        @Test
        @DisplayName("Invalid definition is neither saved nor published")
        void createInvalid() {
            doThrow(new BusinessException("Invalid IF memory configuration", Map.of("interval", "bad")))
                    .when(ifMemoryValidator)
                    .validate(any(IfMemory.class));

            assertThatThrownBy(() -> ifMemoryService.create(memory()))
                    .isInstanceOf(BusinessException.class);
            verify(ifMemoryJpaRepository, never()).save(any());
            verify(eventPublisherHelper, never()).publishIfMemoryCreated(any(), any());
        }

        @Test
        @DisplayName("Update keeps the creation time and publishes an update")
        void update() {
            LocalDateTime createdAt = LocalDateTime.of(2026, 1, 5, 8, 30);
            IfMemory stored = memory(branch("b0", 0, "[v1] > 1"));
            stored.setCreatedAt(createdAt);
            givenStored(stored);
            givenSaveEchoes();

            IfMemory changes = memory(branch("b0", 0, "[v1] > 2"));
            changes.setId(null);
            IfMemory updated = ifMemoryService.update(MEMORY_ID, changes);

            assertThat(updated.getId()).isEqualTo(MEMORY_ID);
            assertThat(updated.getCreatedAt()).isEqualTo(createdAt);
            assertThat(updated.getBranches().get(0).getCondition()).isEqualTo("[v1] > 2");
            verify(eventPublisherHelper).publishIfMemoryUpdated(eq(ifMemoryService), any(IfMemory.class));
        }

        @Test
        @DisplayName("Unknown id is a 404")
        void unknownId() {
            when(ifMemoryJpaRepository.findById(MEMORY_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> ifMemoryService.getById(MEMORY_ID))
                    .isInstanceOfSatisfying(ResourceNotFoundException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
                        assertThat(e.getIdentifier()).isEqualTo(MEMORY_ID.toString());
                    });
        }

        @Test
        @DisplayName("Delete removes the row and tells the engine")
        void delete() {
            when(ifMemoryJpaRepository.existsById(MEMORY_ID)).thenReturn(true);

            ifMemoryService.delete(MEMORY_ID);

            verify(ifMemoryJpaRepository).deleteById(MEMORY_ID);
            verify(eventPublisherHelper).publishIfMemoryDeleted(ifMemoryService, MEMORY_ID);
        }

        @Test
        @DisplayName("Deleting an unknown id is a 404")
        void deleteUnknown() {
            when(ifMemoryJpaRepository.existsById(MEMORY_ID)).thenReturn(false);

            assertThatThrownBy(() -> ifMemoryService.delete(MEMORY_ID))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(ifMemoryJpaRepository, never()).deleteById(any());
        }
    }

    @Nested
    @DisplayName("Enable and disable")
    class EnableDisable {

        @Test
        @DisplayName("Disabling saves without validation and publishes")
        void disable() {
            givenStored(memory());
            givenSaveEchoes();

            IfMemory saved = ifMemoryService.setDisabled(MEMORY_ID, true);

            assertThat(saved.isDisabled()).isTrue();
            verify(ifMemoryValidator, never()).validate(any());
            verify(eventPublisherHelper).publishIfMemoryUpdated(eq(ifMemoryService), any(IfMemory.class));
        }

        @Test
        @DisplayName("Enabling re-validates")
        void enable() {
            IfMemory stored = memory();
            stored.setDisabled(true);
            givenStored(stored);
            givenSaveEchoes();

            ifMemoryService.setDisabled(MEMORY_ID, false);

            verify(ifMemoryValidator).validate(any(IfMemory.class));
        }

        @Test
        @DisplayName("No change is a no-op")
        void unchanged() {
            givenStored(memory());

            ifMemoryService.setDisabled(MEMORY_ID, false);

            verify(ifMemoryJpaRepository, never()).save(any());
            verify(eventPublisherHelper, never()).publishIfMemoryUpdated(any(), any());
        }
    }

    @Nested
    @DisplayName("Branch editing")
    class BranchEditing {

        @Test
        @DisplayName("Inserting at position 0 shifts the others down")
        void addAtFront() {
            givenStored(memory(branch("b0", 0, "[v1] > 1"), branch("b1", 1, "[v1] > 2")));
            givenSaveEchoes();

            IfMemory saved = ifMemoryService.addBranch(
                    MEMORY_ID, Branch.builder().id("client-id").condition("[v1] > 0").build(), 0);

            assertThat(saved.getBranches()).hasSize(3);
            Branch first = saved.sortedBranches().get(0);
            assertThat(first.getCondition()).isEqualTo("[v1] > 0");
            assertThat(first.getId()).isNotEqualTo("client-id");
            assertThat(saved.sortedBranches()).extracting(Branch::getId).endsWith("b0", "b1");
        }

        @Test
        @DisplayName("Null position appends")
        void addAtEnd() {
            givenStored(memory(branch("b0", 0, "[v1] > 1")));
            givenSaveEchoes();

            IfMemory saved = ifMemoryService.addBranch(
                    MEMORY_ID, Branch.builder().condition("[v1] > 0").build(), null);

            assertThat(saved.sortedBranches().get(1).getCondition()).isEqualTo("[v1] > 0");
        }

        @Test
        @DisplayName("Adding a 21st branch is refused")
        void addBeyondLimit() {
            Branch[] twenty = IntStream.range(0, 20)
                    .mapToObj(i -> branch("b" + i, i, "[v1] > " + i))
                    .toArray(Branch[]::new);
            givenStored(memory(twenty));

            assertThatThrownBy(() -> ifMemoryService.addBranch(
                            MEMORY_ID, Branch.builder().condition("[v1] > 0").build(), null))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getDetails()).containsKey("branches"));
            verify(ifMemoryJpaRepository, never()).save(any());
        }

        @Test
        @DisplayName("Removing renumbers the remaining branches")
        void remove() {
            givenStored(memory(branch("b0", 0, "[v1] > 1"), branch("b1", 1, "[v1] > 2"), branch("b2", 2, "true")));
            givenSaveEchoes();

            IfMemory saved = ifMemoryService.removeBranch(MEMORY_ID, "b1");

            assertThat(saved.sortedBranches()).extracting(Branch::getId).containsExactly("b0", "b2");
            assertThat(saved.sortedBranches()).extracting(Branch::getOrder).containsExactly(0, 1);
        }

        @Test
        @DisplayName("Removing an unknown branch is a 404")
        void removeUnknown() {
            givenStored(memory(branch("b0", 0, "[v1] > 1")));

            assertThatThrownBy(() -> ifMemoryService.removeBranch(MEMORY_ID, "zz"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Reorder applies a permutation of branch ids")
        void reorder() {
            givenStored(memory(branch("b0", 0, "[v1] > 1"), branch("b1", 1, "[v1] > 2")));
            givenSaveEchoes();

            IfMemory saved = ifMemoryService.reorderBranches(MEMORY_ID, List.of("b1", "b0"));

            assertThat(saved.sortedBranches()).extracting(Branch::getId).containsExactly("b1", "b0");
            ArgumentCaptor<IfMemory> published = ArgumentCaptor.forClass(IfMemory.class);
            verify(eventPublisherHelper).publishIfMemoryUpdated(eq(ifMemoryService), published.capture());
            assertThat(published.getValue().sortedBranches().get(0).getOrder()).isZero();
        }

        @Test
        @DisplayName("Reorder with a missing id is rejected")
        void reorderNotPermutation() {
            givenStored(memory(branch("b0", 0, "[v1] > 1"), branch("b1", 1, "[v1] > 2")));

            assertThatThrownBy(() -> ifMemoryService.reorderBranches(MEMORY_ID, List.of("b1", "b1")))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                        assertThat(e.getDetails()).containsKey("branchIds");
                    });
        }
    }

    @Nested
    @DisplayName("Condition testing")
    class ConditionTesting {

        @Test
        @DisplayName("Evaluates with operator-supplied values")
        void testCondition() {
            Map<String, Object> values = new HashMap<>();
            values.put("v1", 60);
            values.put("armed", true);

            ConditionResult result = ifMemoryService.testCondition("[v1] >= 50 && [armed]", values);

            assertThat(result.isValid()).isTrue();
            assertThat(result.getResult()).isTrue();
        }

        @Test
        @DisplayName("Missing value reports an unknown alias")
        void missingValue() {
            ConditionResult result = ifMemoryService.testCondition("[v1] >= 50", Map.of());

            assertThat(result.isValid()).isFalse();
            assertThat(result.getError()).isEqualTo("Unknown alias 'v1'");
        }

        @Test
        @DisplayName("Text values are refused")
        void textValue() {
            assertThatThrownBy(() -> ifMemoryService.testCondition("[v1] > 1", Map.of("v1", "hot")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Status and preview delegate to the engine with the stored definition")
    void delegatesToEngine() {
        givenStored(memory());

        ifMemoryService.getStatus(MEMORY_ID);
        ifMemoryService.preview(MEMORY_ID);

        verify(ifMemoryEngine).getStatus(any(IfMemory.class));
        verify(ifMemoryEngine).preview(any(IfMemory.class));
    }
}
