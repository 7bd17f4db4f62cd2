package com.nosota.welfare.repository;

import com.nosota.welfare.model.AdminUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AdminUserRepository extends JpaRepository<AdminUser, UUID> {

    Optional<AdminUser> findByPhone(String phone);

    boolean existsByPhone(String phone);

    /**
     * Users still carrying one of the legacy single-region scope references.
     */
    @Query("SELECT u FROM AdminUser u " +
           "WHERE u.adminScope.districtId IS NOT NULL " +
           "OR u.adminScope.areaId IS NOT NULL " +
           "OR u.adminScope.unitId IS NOT NULL")
    List<AdminUser> findWithLegacyScope();
}
