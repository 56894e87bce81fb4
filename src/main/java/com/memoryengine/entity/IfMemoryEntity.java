package com.memoryengine.entity;

import com.memoryengine.domain.enums.OutputType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the if_memory table.
 *
 * <p>Branches and variable bindings are owned by the row and stored as JSON text
 * ({@code branches}: array of branch objects, {@code variable_aliases}: object of
 * alias -> encoded source reference). {@code output_reference} holds the encoded
 * destination; rows written before typed references existed only carry
 * {@code output_item_id}, which is read as a point GUID.
 */
@Entity
@Table(name = "if_memory")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IfMemoryEntity {

    @Id
    private UUID id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "branches", columnDefinition = "TEXT")
    private String branches;

    @Column(name = "variable_aliases", columnDefinition = "TEXT")
    private String variableAliases;

    @Column(name = "default_value", nullable = false)
    private double defaultValue;

    @Column(name = "output_reference", length = 300)
    private String outputReference;

    /** Legacy destination column, point GUID only. */
    @Column(name = "output_item_id", length = 100)
    private String outputItemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "output_type", nullable = false, columnDefinition = "varchar(20)")
    private OutputType outputType;

    @Column(name = "eval_interval", nullable = false)
    private int interval;

    @Column(name = "is_disabled", nullable = false)
    private boolean disabled;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
