package com.memoryengine.exception;

import java.util.Map;
import lombok.Getter;

/** An IF memory, branch or global variable id that does not exist. Rendered as 404. */
@Getter
public class ResourceNotFoundException extends BaseException {

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " " + identifier + " not found",
                Map.of("resourceType", resourceType, "identifier", identifier));
        this.resourceType = resourceType;
        this.identifier = identifier;
    }
}
