package com.nosota.welfare.repository;

import com.nosota.welfare.model.UserRoleAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserRoleAssignmentRepository extends JpaRepository<UserRoleAssignment, UUID> {

    /**
     * Assignments of a user that are active, already started, not yet expired, and
     * whose role definition is itself active.
     *
     * @param userId The user
     * @param now    Reference instant for the validity window
     * @return Effective assignments, primary role first
     */
    @Query("SELECT a FROM UserRoleAssignment a " +
           "WHERE a.userId = :userId " +
           "AND a.active = true " +
           "AND a.role.active = true " +
           "AND a.validFrom <= :now " +
           "AND (a.validUntil IS NULL OR a.validUntil > :now) " +
           "ORDER BY a.primaryRole DESC")
    List<UserRoleAssignment> findEffectiveAssignments(@Param("userId") UUID userId,
                                                      @Param("now") LocalDateTime now);

    List<UserRoleAssignment> findByUserIdAndRoleNameAndActiveTrue(UUID userId, String roleName);

    /**
     * Deactivates every active assignment whose validity ended before {@code now}.
     *
     * @return Number of deactivated assignments
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserRoleAssignment a SET a.active = false " +
           "WHERE a.active = true " +
           "AND a.validUntil IS NOT NULL " +
           "AND a.validUntil <= :now")
    int deactivateExpired(@Param("now") LocalDateTime now);
}
