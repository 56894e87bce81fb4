package com.memoryengine.event;

import com.memoryengine.domain.model.CycleReport;
import com.memoryengine.domain.model.IfMemory;
import java.util.UUID;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the
 * memory-engine events. Delivery is synchronous ({@code @EventListener}).
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Configuration ----

    public void publishIfMemoryCreated(Object source, IfMemory ifMemory) {
        applicationEventPublisher.publishEvent(
                new IfMemoryChangedEvent(source, ifMemory.getId(), ifMemory, IfMemoryChangeType.CREATED));
    }

    public void publishIfMemoryUpdated(Object source, IfMemory ifMemory) {
        applicationEventPublisher.publishEvent(
                new IfMemoryChangedEvent(source, ifMemory.getId(), ifMemory, IfMemoryChangeType.UPDATED));
    }

    public void publishIfMemoryDeleted(Object source, UUID memoryId) {
        applicationEventPublisher.publishEvent(
                new IfMemoryChangedEvent(source, memoryId, null, IfMemoryChangeType.DELETED));
    }

    // ---- Evaluation ----

    public void publishIfMemoryEvaluated(Object source, CycleReport cycleReport) {
        applicationEventPublisher.publishEvent(new IfMemoryEvaluatedEvent(source, cycleReport));
    }
}
