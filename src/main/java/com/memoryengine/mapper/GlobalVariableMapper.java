package com.memoryengine.mapper;

import com.memoryengine.api.dto.request.GlobalVariableRequest;
import com.memoryengine.api.dto.response.GlobalVariableResponse;
import com.memoryengine.api.dto.response.GlobalVariableUsageResponse;
import com.memoryengine.domain.model.GlobalVariable;
import com.memoryengine.domain.model.GlobalVariableUsage;
import com.memoryengine.entity.GlobalVariableEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper for global variables: entity, domain and REST DTOs. */
@Mapper
public interface GlobalVariableMapper {

    GlobalVariableEntity toEntity(GlobalVariable globalVariable);

    GlobalVariable toDomain(GlobalVariableEntity entity);

    List<GlobalVariable> toDomainList(List<GlobalVariableEntity> entities);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    GlobalVariable toDomain(GlobalVariableRequest request);

    @Mapping(target = "currentValue", source = "currentValue")
    GlobalVariableResponse toResponse(GlobalVariable globalVariable, String currentValue);

    GlobalVariableUsageResponse toResponse(GlobalVariableUsage usage);

    List<GlobalVariableUsageResponse> toUsageResponseList(List<GlobalVariableUsage> usages);
}
