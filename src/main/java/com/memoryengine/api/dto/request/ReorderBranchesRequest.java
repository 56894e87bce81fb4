package com.memoryengine.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Every branch id of the IF memory, in the new evaluation order. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReorderBranchesRequest {

    @NotEmpty
    private List<String> branchIds;
}
