package com.nosota.welfare.repository;

import com.nosota.welfare.model.RoleDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RoleDefinitionRepository extends JpaRepository<RoleDefinition, UUID> {

    Optional<RoleDefinition> findByName(String name);
}
