package com.memoryengine.api.controller;

import com.memoryengine.api.dto.request.GlobalVariableRequest;
import com.memoryengine.api.dto.request.GlobalVariableValueRequest;
import com.memoryengine.api.dto.response.GlobalVariableResponse;
import com.memoryengine.api.dto.response.GlobalVariableUsageResponse;
import com.memoryengine.domain.model.GlobalVariable;
import com.memoryengine.mapper.GlobalVariableMapper;
import com.memoryengine.service.GlobalVariableService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** REST API for global-variable definitions, their usages and live values. */
@RestController
@RequestMapping("/api/global-variables")
public class GlobalVariableController {

    private final GlobalVariableService globalVariableService;

    private final GlobalVariableMapper globalVariableMapper = Mappers.getMapper(GlobalVariableMapper.class);

    public GlobalVariableController(GlobalVariableService globalVariableService) {
        this.globalVariableService = globalVariableService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GlobalVariableResponse create(@RequestBody @Valid GlobalVariableRequest request) {
        return toResponse(globalVariableService.create(globalVariableMapper.toDomain(request)));
    }

    @GetMapping
    public List<GlobalVariableResponse> getAll() {
        return globalVariableService.findAll().stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}")
    public GlobalVariableResponse get(@PathVariable UUID id) {
        return toResponse(globalVariableService.getById(id));
    }

    @PutMapping("/{id}")
    public GlobalVariableResponse update(@PathVariable UUID id, @RequestBody @Valid GlobalVariableRequest request) {
        return toResponse(globalVariableService.update(id, globalVariableMapper.toDomain(request)));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        globalVariableService.delete(id);
    }

    @GetMapping("/{id}/usages")
    public List<GlobalVariableUsageResponse> usages(@PathVariable UUID id) {
        return globalVariableMapper.toUsageResponseList(globalVariableService.getUsages(id));
    }

    @PutMapping("/{id}/value")
    public GlobalVariableResponse setValue(
            @PathVariable UUID id, @RequestBody @Valid GlobalVariableValueRequest request) {
        String stored = globalVariableService.setValue(id, request.getValue());
        return globalVariableMapper.toResponse(globalVariableService.getById(id), stored);
    }

    private GlobalVariableResponse toResponse(GlobalVariable globalVariable) {
        return globalVariableMapper.toResponse(
                globalVariable, globalVariableService.currentValue(globalVariable).orElse(null));
    }
}
