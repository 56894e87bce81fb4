package com.memoryengine.ifmemory;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the IF-memory engine under the {@code if-memory-engine} prefix.
 *
 * <ul>
 *   <li>{@code enabled} -- master toggle; when false nothing is scheduled</li>
 *   <li>{@code maxBranches} -- hard cap on branches per IF memory</li>
 *   <li>{@code maxConditionLength} -- longest accepted condition text</li>
 *   <li>{@code schedulerPoolSize} -- threads shared by all instance timers</li>
 *   <li>{@code staleAfterFailures} -- consecutive resolution failures before an instance reports STALE</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "if-memory-engine")
public class IfMemoryEngineConfig {

    private boolean enabled = true;
    private int maxBranches = 20;
    private int maxConditionLength = 2000;
    private int schedulerPoolSize = 4;
    private int staleAfterFailures = 3;
}
