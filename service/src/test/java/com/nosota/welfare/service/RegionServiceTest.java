package com.nosota.welfare.service;

import com.nosota.welfare.api.model.RegionType;
import com.nosota.welfare.api.model.UserRole;
import com.nosota.welfare.error.AccessDeniedException;
import com.nosota.welfare.error.InvalidStateException;
import com.nosota.welfare.error.ValidationException;
import com.nosota.welfare.model.AdminScope;
import com.nosota.welfare.model.AdminUser;
import com.nosota.welfare.model.Region;
import com.nosota.welfare.repository.RegionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Region service")
class RegionServiceTest {

    @Mock
    private RegionRepository regionRepository;

    private RegionService regionService;

    private AdminUser stateAdmin;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        regionService = new RegionService(regionRepository, clock);

        stateAdmin = new AdminUser();
        stateAdmin.setId(UUID.randomUUID());
        stateAdmin.setRole(UserRole.STATE_ADMIN);
        stateAdmin.setActive(true);
    }

    private static Region region(String name, RegionType type, UUID parentId) {
        Region region = new Region();
        region.setId(UUID.randomUUID());
        region.setName(name);
        region.setCode(name.toUpperCase());
        region.setType(type);
        region.setParentId(parentId);
        region.setActive(true);
        return region;
    }

    private void stubSave() {
        when(regionRepository.save(any(Region.class))).thenAnswer(inv -> {
            Region region = inv.getArgument(0);
            if (region.getId() == null) {
                region.setId(UUID.randomUUID());
            }
            return region;
        });
    }

    @Test
    @DisplayName("State is created without parent and with an upper-cased code")
    void createState() {
        stubSave();

        Region state = regionService.createRegion(stateAdmin, " Kerala ", "kl", RegionType.STATE, null);

        assertThat(state.getId()).isNotNull();
        assertThat(state.getName()).isEqualTo("Kerala");
        assertThat(state.getCode()).isEqualTo("KL");
        assertThat(state.isActive()).isTrue();
        assertThat(state.getCreatedBy()).isEqualTo(stateAdmin.getId());
    }

    @Test
    @DisplayName("District is created under an active state")
    void createDistrict() {
        Region state = region("Kerala", RegionType.STATE, null);
        when(regionRepository.findById(state.getId())).thenReturn(Optional.of(state));
        stubSave();

        Region district = regionService.createRegion(stateAdmin, "Malappuram", "mlp", RegionType.DISTRICT,
                state.getId());

        assertThat(district.getParentId()).isEqualTo(state.getId());
        assertThat(district.getType()).isEqualTo(RegionType.DISTRICT);
    }

    @Test
    @DisplayName("Parent must exist, be active and sit exactly one level up")
    void invalidParent() {
        assertThatThrownBy(() -> regionService.createRegion(stateAdmin, "Malappuram", "MLP",
                RegionType.DISTRICT, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("parentId");

        Region state = region("Kerala", RegionType.STATE, null);
        when(regionRepository.findById(state.getId())).thenReturn(Optional.of(state));
        assertThatThrownBy(() -> regionService.createRegion(stateAdmin, "Tirur", "TIR",
                RegionType.AREA, state.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("must be a DISTRICT");

        Region retired = region("Old", RegionType.DISTRICT, state.getId());
        retired.setActive(false);
        when(regionRepository.findById(retired.getId())).thenReturn(Optional.of(retired));
        assertThatThrownBy(() -> regionService.createRegion(stateAdmin, "Tirur", "TIR",
                RegionType.AREA, retired.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("inactive");

        assertThatThrownBy(() -> regionService.createRegion(stateAdmin, "Kerala", "KL",
                RegionType.STATE, state.getId()))
                .isInstanceOf(ValidationException.class);

        verify(regionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Code must be unique among siblings")
    void duplicateCode() {
        Region state = region("Kerala", RegionType.STATE, null);
        when(regionRepository.findById(state.getId())).thenReturn(Optional.of(state));
        when(regionRepository.findByParentIdAndCode(state.getId(), "MLP"))
                .thenReturn(Optional.of(region("Mlp", RegionType.DISTRICT, state.getId())));

        assertThatThrownBy(() -> regionService.createRegion(stateAdmin, "Malappuram", "mlp",
                RegionType.DISTRICT, state.getId()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    @DisplayName("Only super, state and district admins manage regions")
    void regionManagersOnly() {
        AdminUser areaAdmin = new AdminUser();
        areaAdmin.setId(UUID.randomUUID());
        areaAdmin.setRole(UserRole.AREA_ADMIN);
        areaAdmin.setActive(true);

        assertThatThrownBy(() -> regionService.createRegion(areaAdmin, "Kerala", "KL", RegionType.STATE, null))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> regionService.deactivateRegion(areaAdmin, UUID.randomUUID()))
                .isInstanceOf(AccessDeniedException.class);
    }

    @Nested
    @DisplayName("District admin")
    class DistrictAdminScope {

        private Region state;
        private Region ownDistrict;
        private Region foreignDistrict;
        private Region ownArea;
        private AdminUser districtAdmin;

        @BeforeEach
        void setUp() {
            state = region("Kerala", RegionType.STATE, null);
            ownDistrict = region("Malappuram", RegionType.DISTRICT, state.getId());
            foreignDistrict = region("Kozhikode", RegionType.DISTRICT, state.getId());
            ownArea = region("Tirur", RegionType.AREA, ownDistrict.getId());

            AdminScope scope = new AdminScope();
            scope.setRegions(Set.of(ownDistrict.getId()));
            districtAdmin = new AdminUser();
            districtAdmin.setId(UUID.randomUUID());
            districtAdmin.setRole(UserRole.DISTRICT_ADMIN);
            districtAdmin.setAdminScope(scope);
            districtAdmin.setActive(true);
        }

        private void stubTree() {
            List<Region> all = List.of(state, ownDistrict, foreignDistrict, ownArea);
            when(regionRepository.findByParentIdIn(anyCollection())).thenAnswer(inv -> {
                Collection<UUID> parents = inv.getArgument(0);
                return all.stream().filter(r -> r.getParentId() != null && parents.contains(r.getParentId())).toList();
            });
        }

        @Test
        @DisplayName("Creates areas under its own district and units below them")
        void createsWithinOwnSubtree() {
            when(regionRepository.findById(ownDistrict.getId())).thenReturn(Optional.of(ownDistrict));
            when(regionRepository.findById(ownArea.getId())).thenReturn(Optional.of(ownArea));
            stubTree();
            stubSave();

            Region area = regionService.createRegion(districtAdmin, "Ponnani", "PON", RegionType.AREA,
                    ownDistrict.getId());
            Region unit = regionService.createRegion(districtAdmin, "Ward 3", "W3", RegionType.UNIT,
                    ownArea.getId());

            assertThat(area.getParentId()).isEqualTo(ownDistrict.getId());
            assertThat(unit.getParentId()).isEqualTo(ownArea.getId());
        }

        @Test
        @DisplayName("Cannot create regions under a foreign district or a state")
        void createOutsideScopeDenied() {
            stubTree();

            assertThatThrownBy(() -> regionService.createRegion(districtAdmin, "Vadakara", "VDK",
                    RegionType.AREA, foreignDistrict.getId()))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> regionService.createRegion(districtAdmin, "Wayanad", "WYD",
                    RegionType.DISTRICT, state.getId()))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> regionService.createRegion(districtAdmin, "Karnataka", "KA",
                    RegionType.STATE, null))
                    .isInstanceOf(AccessDeniedException.class);

            verify(regionRepository, never()).save(any());
        }

        @Test
        @DisplayName("Renames its own district but not a foreign one")
        void updateLimitedToOwnSubtree() {
            when(regionRepository.findById(ownDistrict.getId())).thenReturn(Optional.of(ownDistrict));
            stubTree();
            stubSave();

            assertThat(regionService.updateRegion(districtAdmin, ownDistrict.getId(), "Malappuram North", null)
                    .getName()).isEqualTo("Malappuram North");

            assertThatThrownBy(() -> regionService.updateRegion(districtAdmin, foreignDistrict.getId(),
                    "Renamed", null))
                    .isInstanceOf(AccessDeniedException.class);
            assertThat(foreignDistrict.getName()).isEqualTo("Kozhikode");
        }

        @Test
        @DisplayName("Cannot deactivate regions, even inside its own district")
        void deactivateDenied() {
            assertThatThrownBy(() -> regionService.deactivateRegion(districtAdmin, foreignDistrict.getId()))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> regionService.deactivateRegion(districtAdmin, ownArea.getId()))
                    .isInstanceOf(AccessDeniedException.class);

            assertThat(foreignDistrict.isActive()).isTrue();
            assertThat(ownArea.isActive()).isTrue();
            verify(regionRepository, never()).save(any());
        }

        @Test
        @DisplayName("Legacy district reference bounds the scope when the regions set is empty")
        void legacyReference() {
            AdminScope legacy = new AdminScope();
            legacy.setDistrictId(ownDistrict.getId());
            districtAdmin.setAdminScope(legacy);
            stubTree();

            assertThat(regionService.isWithinScope(districtAdmin, Set.of(ownArea.getId()))).isTrue();
            assertThat(regionService.isWithinScope(districtAdmin, Set.of(ownArea.getId(), foreignDistrict.getId())))
                    .isFalse();
        }
    }

    @Test
    @DisplayName("Region with active children cannot be deactivated")
    void deactivateWithChildren() {
        Region state = region("Kerala", RegionType.STATE, null);
        when(regionRepository.findById(state.getId())).thenReturn(Optional.of(state));
        when(regionRepository.existsByParentIdAndActiveTrue(state.getId())).thenReturn(true);

        assertThatThrownBy(() -> regionService.deactivateRegion(stateAdmin, state.getId()))
                .isInstanceOf(InvalidStateException.class);
        assertThat(state.isActive()).isTrue();
    }

    @Test
    @DisplayName("Descendants are collected across every level below the root")
    void descendants() {
        Region state = region("Kerala", RegionType.STATE, null);
        Region district = region("Malappuram", RegionType.DISTRICT, state.getId());
        Region otherDistrict = region("Kozhikode", RegionType.DISTRICT, state.getId());
        Region area = region("Tirur", RegionType.AREA, district.getId());
        Region unit = region("Ward 7", RegionType.UNIT, area.getId());
        unit.setActive(false);
        List<Region> all = List.of(state, district, otherDistrict, area, unit);

        when(regionRepository.findByParentIdIn(anyCollection())).thenAnswer(inv -> {
            Collection<UUID> parents = inv.getArgument(0);
            return all.stream().filter(r -> r.getParentId() != null && parents.contains(r.getParentId())).toList();
        });

        assertThat(regionService.getDescendantIds(district.getId()))
                .containsExactlyInAnyOrder(area.getId(), unit.getId());
        assertThat(regionService.getDescendantIds(state.getId()))
                .containsExactlyInAnyOrder(district.getId(), otherDistrict.getId(), area.getId(), unit.getId());
        assertThat(regionService.getDescendantIds(unit.getId())).isEmpty();
    }

    @Test
    @DisplayName("Path lists names from the state down")
    void path() {
        Region state = region("Kerala", RegionType.STATE, null);
        Region district = region("Malappuram", RegionType.DISTRICT, state.getId());
        Region area = region("Tirur", RegionType.AREA, district.getId());
        when(regionRepository.findById(state.getId())).thenReturn(Optional.of(state));
        when(regionRepository.findById(district.getId())).thenReturn(Optional.of(district));
        when(regionRepository.findById(area.getId())).thenReturn(Optional.of(area));

        assertThat(regionService.getPath(area.getId())).containsExactly("Kerala", "Malappuram", "Tirur");
    }
}
