package com.memoryengine.repository.jpa;

import com.memoryengine.entity.GlobalVariableEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GlobalVariableJpaRepository extends JpaRepository<GlobalVariableEntity, UUID> {

    Optional<GlobalVariableEntity> findByName(String name);

    boolean existsByName(String name);

    List<GlobalVariableEntity> findAllByOrderByNameAsc();
}
