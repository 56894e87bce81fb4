package com.memoryengine.api.dto.response;

import com.memoryengine.domain.enums.UsageKind;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GlobalVariableUsageResponse {

    private UUID memoryId;
    private String memoryName;
    private UsageKind usage;
    private String alias;
}
