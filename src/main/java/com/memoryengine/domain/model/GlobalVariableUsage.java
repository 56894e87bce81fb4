package com.memoryengine.domain.model;

import com.memoryengine.domain.enums.UsageKind;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/** One reference from an IF memory to a global variable; {@code alias} is null for outputs. */
@Getter
@AllArgsConstructor
@Builder
public class GlobalVariableUsage {

    private final UUID memoryId;
    private final String memoryName;
    private final UsageKind usage;
    private final String alias;
}
