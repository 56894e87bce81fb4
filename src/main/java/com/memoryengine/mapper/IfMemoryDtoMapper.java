package com.memoryengine.mapper;

import com.memoryengine.api.dto.request.BranchRequest;
import com.memoryengine.api.dto.request.IfMemoryRequest;
import com.memoryengine.api.dto.request.VariableBindingRequest;
import com.memoryengine.api.dto.response.BranchResponse;
import com.memoryengine.api.dto.response.BranchWarningResponse;
import com.memoryengine.api.dto.response.EvaluationPreviewResponse;
import com.memoryengine.api.dto.response.IfMemoryResponse;
import com.memoryengine.api.dto.response.IfMemoryStatusResponse;
import com.memoryengine.api.dto.response.TestConditionResponse;
import com.memoryengine.api.dto.response.VariableBindingResponse;
import com.memoryengine.domain.model.Branch;
import com.memoryengine.domain.model.BranchSelection;
import com.memoryengine.domain.model.BranchWarning;
import com.memoryengine.domain.model.ConditionResult;
import com.memoryengine.domain.model.EvaluationPreview;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.domain.model.InstanceStatus;
import com.memoryengine.domain.model.SourceReference;
import com.memoryengine.domain.model.VariableBinding;
import com.memoryengine.ifmemory.SourceReferenceCodec;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for IF-memory DTOs, used by IfMemoryController at the API boundary.
 *
 * <p>Source references travel as encoded strings; decoding a malformed one throws
 * {@link IllegalArgumentException}, which the exception handler turns into a 400.
 */
@Mapper
public interface IfMemoryDtoMapper {

    // IfMemory: Request -> Domain
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    IfMemory toDomain(IfMemoryRequest request);

    Branch toDomain(BranchRequest request);

    VariableBinding toDomain(VariableBindingRequest request);

    // IfMemory: Domain -> Response
    IfMemoryResponse toResponse(IfMemory domain);

    List<IfMemoryResponse> toResponseList(List<IfMemory> domains);

    BranchResponse toResponse(Branch branch);

    VariableBindingResponse toResponse(VariableBinding binding);

    BranchWarningResponse toResponse(BranchWarning warning);

    IfMemoryStatusResponse toResponse(InstanceStatus status);

    TestConditionResponse toResponse(ConditionResult result);

    default EvaluationPreviewResponse toResponse(EvaluationPreview preview) {
        if (preview == null) {
            return null;
        }
        EvaluationPreviewResponse.EvaluationPreviewResponseBuilder builder = EvaluationPreviewResponse.builder()
                .memoryId(preview.getMemoryId())
                .evaluated(preview.getResolutionError() == null)
                .resolutionError(preview.getResolutionError());

        if (preview.getBindings() != null) {
            builder.bindings(preview.getBindings().toEvaluationVariables());
        }
        BranchSelection selection = preview.getSelection();
        if (selection != null) {
            builder.selectedOrder(selection.getSelectedOrder())
                    .selectedBranchId(selection.getSelectedBranchId())
                    .selectedBranchName(selection.getSelectedBranchName())
                    .value(selection.getValue())
                    .held(selection.isHeld())
                    .usedDefault(selection.isDefault())
                    .warnings(selection.getWarnings().stream().map(this::toResponse).toList());
        }
        return builder.build();
    }

    default SourceReference toReference(String encoded) {
        return encoded == null ? null : SourceReferenceCodec.decode(encoded);
    }

    default String fromReference(SourceReference reference) {
        return reference == null ? null : SourceReferenceCodec.encode(reference);
    }
}
