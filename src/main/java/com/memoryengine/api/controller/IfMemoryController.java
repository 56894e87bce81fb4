package com.memoryengine.api.controller;

import com.memoryengine.api.dto.request.BranchRequest;
import com.memoryengine.api.dto.request.IfMemoryRequest;
import com.memoryengine.api.dto.request.ReorderBranchesRequest;
import com.memoryengine.api.dto.request.TestConditionRequest;
import com.memoryengine.api.dto.response.EvaluationPreviewResponse;
import com.memoryengine.api.dto.response.IfMemoryResponse;
import com.memoryengine.api.dto.response.IfMemoryStatusResponse;
import com.memoryengine.api.dto.response.TestConditionResponse;
import com.memoryengine.domain.model.IfMemory;
import com.memoryengine.mapper.IfMemoryDtoMapper;
import com.memoryengine.service.IfMemoryService;
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

/**
 * REST API for IF memories.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/if-memories} -- create</li>
 *   <li>{@code GET /api/if-memories} -- list</li>
 *   <li>{@code GET /api/if-memories/{id}} -- get one</li>
 *   <li>{@code PUT /api/if-memories/{id}} -- replace the definition</li>
 *   <li>{@code DELETE /api/if-memories/{id}} -- delete</li>
 *   <li>{@code POST /api/if-memories/{id}/disable|enable} -- suspend or resume evaluation</li>
 *   <li>{@code POST /api/if-memories/{id}/branches} -- add a branch</li>
 *   <li>{@code DELETE /api/if-memories/{id}/branches/{branchId}} -- remove a branch</li>
 *   <li>{@code POST /api/if-memories/{id}/branches/reorder} -- set branch priority</li>
 *   <li>{@code GET /api/if-memories/{id}/status} -- runtime status</li>
 *   <li>{@code POST /api/if-memories/{id}/preview} -- dry run against live data</li>
 *   <li>{@code POST /api/if-memories/test-condition} -- dry run of one condition</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/if-memories")
public class IfMemoryController {

    private final IfMemoryService ifMemoryService;

    private final IfMemoryDtoMapper ifMemoryDtoMapper = Mappers.getMapper(IfMemoryDtoMapper.class);

    public IfMemoryController(IfMemoryService ifMemoryService) {
        this.ifMemoryService = ifMemoryService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public IfMemoryResponse create(@RequestBody @Valid IfMemoryRequest request) {
        IfMemory created = ifMemoryService.create(ifMemoryDtoMapper.toDomain(request));
        return ifMemoryDtoMapper.toResponse(created);
    }

    @GetMapping
    public List<IfMemoryResponse> getAll() {
        return ifMemoryDtoMapper.toResponseList(ifMemoryService.findAll());
    }

    @GetMapping("/{id}")
    public IfMemoryResponse get(@PathVariable UUID id) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.getById(id));
    }

    @PutMapping("/{id}")
    public IfMemoryResponse update(@PathVariable UUID id, @RequestBody @Valid IfMemoryRequest request) {
        IfMemory updated = ifMemoryService.update(id, ifMemoryDtoMapper.toDomain(request));
        return ifMemoryDtoMapper.toResponse(updated);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        ifMemoryService.delete(id);
    }

    @PostMapping("/{id}/disable")
    public IfMemoryResponse disable(@PathVariable UUID id) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.setDisabled(id, true));
    }

    @PostMapping("/{id}/enable")
    public IfMemoryResponse enable(@PathVariable UUID id) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.setDisabled(id, false));
    }

    @PostMapping("/{id}/branches")
    @ResponseStatus(HttpStatus.CREATED)
    public IfMemoryResponse addBranch(@PathVariable UUID id, @RequestBody BranchRequest request) {
        IfMemory updated = ifMemoryService.addBranch(id, ifMemoryDtoMapper.toDomain(request), request.getOrder());
        return ifMemoryDtoMapper.toResponse(updated);
    }

    @DeleteMapping("/{id}/branches/{branchId}")
    public IfMemoryResponse removeBranch(@PathVariable UUID id, @PathVariable String branchId) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.removeBranch(id, branchId));
    }

    @PostMapping("/{id}/branches/reorder")
    public IfMemoryResponse reorderBranches(
            @PathVariable UUID id, @RequestBody @Valid ReorderBranchesRequest request) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.reorderBranches(id, request.getBranchIds()));
    }

    @GetMapping("/{id}/status")
    public IfMemoryStatusResponse status(@PathVariable UUID id) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.getStatus(id));
    }

    @PostMapping("/{id}/preview")
    public EvaluationPreviewResponse preview(@PathVariable UUID id) {
        return ifMemoryDtoMapper.toResponse(ifMemoryService.preview(id));
    }

    @PostMapping("/test-condition")
    public TestConditionResponse testCondition(@RequestBody @Valid TestConditionRequest request) {
        return ifMemoryDtoMapper.toResponse(
                ifMemoryService.testCondition(request.getCondition(), request.getValues()));
    }
}
