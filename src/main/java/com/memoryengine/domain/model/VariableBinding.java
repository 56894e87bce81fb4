package com.memoryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Binds an alias used in condition text ({@code [alias]}) to a live source.
 * Aliases are case-sensitive and unique within one IF memory.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
public class VariableBinding {

    private String alias;
    private SourceReference source;
}
