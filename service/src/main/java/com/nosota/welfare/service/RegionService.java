package com.nosota.welfare.service;

import com.nosota.welfare.api.model.RegionType;
import com.nosota.welfare.error.AccessDeniedException;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.RecordNotFoundException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.model.AdminScope;
import com.nosota.welfare.model.AdminUser;
import com.nosota.welfare.model.Region;
import com.nosota.welfare.repository.RegionRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Maintains the administrative region tree ({@code state → district → area → unit}).
 *
 * <p>Only SUPER_ADMIN, STATE_ADMIN and DISTRICT_ADMIN may create or edit regions. A
 * district admin is further limited to its own subtree: it edits its districts and
 * creates regions below them. Regions are retired with {@link #deactivateRegion}, never
 * deleted, and only by SUPER_ADMIN or STATE_ADMIN.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class RegionService {

    private final RegionRepository regionRepository;
    private final Clock clock;

    /**
     * Creates a region under {@code parentId}.
     *
     * @param actor    Acting admin
     * @param name     Display name
     * @param code     Code, stored upper-cased and unique among siblings
     * @param type     Region level
     * @param parentId Parent region; must be null for STATE, otherwise an active region one level up
     * @return The created region
     * @throws AccessDeniedException if the actor may not manage regions, or the parent lies
     *                               outside the actor's subtree
     * @throws ValidationException   if the input or the parent is invalid, or the code is taken
     */
    @Transactional
    public Region createRegion(AdminUser actor, String name, String code,
                               @NotNull RegionType type, UUID parentId) {
        requireRegionManager(actor);

        Map<String, String> errors = new LinkedHashMap<>();
        if (name == null || name.isBlank()) {
            errors.put("name", "is required");
        }
        if (code == null || code.isBlank()) {
            errors.put("code", "is required");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        requireWithinScope(actor, parentId);
        validateParent(type, parentId);

        String normalizedCode = normalizeCode(code);
        if (findSibling(parentId, normalizedCode).isPresent()) {
            throw new ValidationException("code", "already exists under this parent");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Region region = new Region();
        region.setName(name.trim());
        region.setCode(normalizedCode);
        region.setType(type);
        region.setParentId(parentId);
        region.setActive(true);
        region.setCreatedBy(actor.getId());
        region.setCreatedAt(now);
        region.setUpdatedAt(now);

        region = regionRepository.save(region);

        log.info("Region created: id={}, type={}, code={}, parent={}, by={}",
                region.getId(), type, normalizedCode, parentId, actor.getId());

        return region;
    }

    /**
     * Renames a region or changes its code. {@code null} arguments leave the field unchanged.
     */
    @Transactional
    public Region updateRegion(AdminUser actor, @NotNull UUID id, String name, String code) {
        requireRegionManager(actor);
        requireWithinScope(actor, id);

        Region region = getRegion(id);

        if (name != null) {
            if (name.isBlank()) {
                throw new ValidationException("name", "must not be blank");
            }
            region.setName(name.trim());
        }

        if (code != null) {
            if (code.isBlank()) {
                throw new ValidationException("code", "must not be blank");
            }
            String normalizedCode = normalizeCode(code);
            Optional<Region> sibling = findSibling(region.getParentId(), normalizedCode);
            if (sibling.isPresent() && !sibling.get().getId().equals(region.getId())) {
                throw new ValidationException("code", "already exists under this parent");
            }
            region.setCode(normalizedCode);
        }

        region.setUpdatedAt(LocalDateTime.now(clock));
        region = regionRepository.save(region);

        log.info("Region updated: id={}, by={}", id, actor.getId());
        return region;
    }

    /**
     * Retires a region.
     *
     * @throws AccessDeniedException if the actor is not SUPER_ADMIN or STATE_ADMIN
     * @throws InvalidStateException if the region still has active children
     */
    @Transactional
    public Region deactivateRegion(AdminUser actor, @NotNull UUID id) {
        requireRegionManager(actor);
        if (!actor.getRole().isGlobal()) {
            throw new AccessDeniedException();
        }

        Region region = getRegion(id);
        if (!region.isActive()) {
            log.debug("Region {} already inactive", id);
            return region;
        }

        if (regionRepository.existsByParentIdAndActiveTrue(id)) {
            throw new InvalidStateException("Region has active child regions");
        }

        region.setActive(false);
        region.setUpdatedAt(LocalDateTime.now(clock));
        region = regionRepository.save(region);

        log.info("Region deactivated: id={}, by={}", id, actor.getId());
        return region;
    }

    public Region getRegion(@NotNull UUID id) {
        return regionRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Region"));
    }

    public List<Region> getChildren(@NotNull UUID id) {
        return regionRepository.findByParentIdOrderByNameAsc(id);
    }

    /**
     * Collects every region below {@code id}, level by level.
     *
     * <p>Inactive regions are included: historical records keep pointing at them and
     * must stay reachable through their ancestors.
     *
     * @param id Root of the subtree
     * @return Descendant ids, excluding {@code id} itself
     */
    public Set<UUID> getDescendantIds(@NotNull UUID id) {
        Set<UUID> descendants = new LinkedHashSet<>();
        Set<UUID> frontier = Set.of(id);

        while (!frontier.isEmpty()) {
            Set<UUID> next = new LinkedHashSet<>();
            for (Region child : regionRepository.findByParentIdIn(frontier)) {
                if (!child.getId().equals(id) && descendants.add(child.getId())) {
                    next.add(child.getId());
                }
            }
            frontier = next;
        }

        return descendants;
    }

    /**
     * Checks that every region in {@code regionIds} lies within the actor's own regions
     * or below them.
     *
     * <p>Global roles cover every region. Other actors are bounded by their
     * {@code adminScope.regions} set together with the legacy reference at their level;
     * an actor with neither covers nothing. An empty {@code regionIds} is always covered.
     *
     * @param actor     Acting admin, may be null
     * @param regionIds Regions the actor wants to act on
     * @return {@code true} if the actor may act on all of them
     */
    public boolean isWithinScope(AdminUser actor, Collection<UUID> regionIds) {
        if (actor == null || !actor.isActive() || actor.getRole() == null) {
            return false;
        }
        if (actor.getRole().isGlobal() || regionIds.isEmpty()) {
            return true;
        }
        if (regionIds.stream().anyMatch(Objects::isNull)) {
            return false;
        }

        Set<UUID> covered = new HashSet<>();
        AdminScope scope = actor.getAdminScope();
        if (scope != null) {
            if (scope.getRegions() != null) {
                covered.addAll(scope.getRegions());
            }
            UUID legacy = scope.legacyRegionAt(actor.getRole().regionLevel());
            if (legacy != null) {
                covered.add(legacy);
            }
        }
        if (covered.isEmpty()) {
            return false;
        }
        if (covered.containsAll(regionIds)) {
            return true;
        }

        for (UUID root : Set.copyOf(covered)) {
            covered.addAll(getDescendantIds(root));
        }
        return covered.containsAll(regionIds);
    }

    /**
     * Names from the root state down to the given region.
     */
    public List<String> getPath(@NotNull UUID id) {
        LinkedList<String> path = new LinkedList<>();
        Set<UUID> visited = new HashSet<>();

        UUID currentId = id;
        while (currentId != null && visited.add(currentId)) {
            Region current = getRegion(currentId);
            path.addFirst(current.getName());
            currentId = current.getParentId();
        }

        return path;
    }

    private void validateParent(RegionType type, UUID parentId) {
        RegionType expectedParentType = type.parentType();

        if (expectedParentType == null) {
            if (parentId != null) {
                throw new ValidationException("parentId", "must be empty for " + type);
            }
            return;
        }

        if (parentId == null) {
            throw new ValidationException("parentId", "is required for " + type);
        }

        Region parent = regionRepository.findById(parentId)
                .orElseThrow(() -> new ValidationException("parentId", "does not exist"));

        if (!parent.isActive()) {
            throw new ValidationException("parentId", "is inactive");
        }
        if (parent.getType() != expectedParentType) {
            throw new ValidationException("parentId",
                    "must be a " + expectedParentType + " for " + type + ", got " + parent.getType());
        }
    }

    private Optional<Region> findSibling(UUID parentId, String code) {
        return parentId == null
                ? regionRepository.findByParentIdIsNullAndCode(code)
                : regionRepository.findByParentIdAndCode(parentId, code);
    }

    private static String normalizeCode(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private void requireWithinScope(AdminUser actor, UUID regionId) {
        boolean allowed = regionId == null
                ? actor.getRole().isGlobal()
                : isWithinScope(actor, Set.of(regionId));
        if (!allowed) {
            log.warn("Region {} is outside the scope of user {}", regionId, actor.getId());
            throw new AccessDeniedException();
        }
    }

    private static void requireRegionManager(AdminUser actor) {
        if (actor == null || !actor.isActive() || actor.getRole() == null
                || !actor.getRole().canManageRegions()) {
            throw new AccessDeniedException();
        }
    }
}
