package com.memoryengine.repository.jpa;

import com.memoryengine.entity.IfMemoryEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the if_memory table.
 *
 * <p>The engine loads the enabled rows at startup and then follows change events; the
 * services use the full list for global-variable usage lookups, which decode the JSON
 * columns rather than pattern-matching them in SQL.
 */
@Repository
public interface IfMemoryJpaRepository extends JpaRepository<IfMemoryEntity, UUID> {

    List<IfMemoryEntity> findAllByOrderByNameAsc();

    List<IfMemoryEntity> findByDisabledFalse();
}
