package com.memoryengine.event;

import com.memoryengine.domain.model.CycleReport;
import org.springframework.context.ApplicationEvent;

/** Published by the engine after every scheduled or on-demand cycle that was not skipped. */
public class IfMemoryEvaluatedEvent extends ApplicationEvent {

    private final CycleReport cycleReport;

    public IfMemoryEvaluatedEvent(Object source, CycleReport cycleReport) {
        super(source);
        this.cycleReport = cycleReport;
    }

    public CycleReport getCycleReport() {
        return cycleReport;
    }
}
