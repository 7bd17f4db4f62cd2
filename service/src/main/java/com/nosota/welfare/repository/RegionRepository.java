package com.nosota.welfare.repository;

import com.nosota.welfare.model.Region;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RegionRepository extends JpaRepository<Region, UUID> {

    List<Region> findByParentIdOrderByNameAsc(UUID parentId);

    /**
     * Children of all given parents, active or not. Used for breadth-first
     * descendant expansion, one query per tree level.
     */
    List<Region> findByParentIdIn(Collection<UUID> parentIds);

    boolean existsByParentIdAndActiveTrue(UUID parentId);

    Optional<Region> findByParentIdAndCode(UUID parentId, String code);

    /**
     * Root regions have no parent, so code uniqueness among them is checked separately.
     */
    Optional<Region> findByParentIdIsNullAndCode(String code);
}
