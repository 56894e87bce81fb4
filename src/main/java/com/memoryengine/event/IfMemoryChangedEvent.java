package com.memoryengine.event;

import com.memoryengine.domain.model.IfMemory;
import java.util.UUID;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the configuration services after an IF memory was saved or removed.
 *
 * <p>Consumed by {@code IfMemoryEngine}, which installs the new definition, resets
 * hysteresis state on structural change and reschedules or cancels the instance timer.
 * {@code ifMemory} is null for {@link IfMemoryChangeType#DELETED}.
 */
public class IfMemoryChangedEvent extends ApplicationEvent {

    private final UUID memoryId;
    private final IfMemory ifMemory;
    private final IfMemoryChangeType changeType;

    public IfMemoryChangedEvent(Object source, UUID memoryId, IfMemory ifMemory, IfMemoryChangeType changeType) {
        super(source);
        this.memoryId = memoryId;
        this.ifMemory = ifMemory;
        this.changeType = changeType;
    }

    public UUID getMemoryId() {
        return memoryId;
    }

    public IfMemory getIfMemory() {
        return ifMemory;
    }

    public IfMemoryChangeType getChangeType() {
        return changeType;
    }
}
