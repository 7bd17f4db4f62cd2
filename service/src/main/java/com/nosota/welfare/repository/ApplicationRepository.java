package com.nosota.welfare.repository;

import com.nosota.welfare.model.Application;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    /**
     * Loads an application and locks its row for the rest of the transaction.
     * <p>
     * Schedule generation holds this lock while it checks for an existing active
     * schedule and inserts the new batch, so two concurrent generations for one
     * application are serialized and the second one sees the first one's rows.
     * </p>
     *
     * @param id Application id
     * @return The locked application, if it exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Application a WHERE a.id = :id")
    Optional<Application> findByIdForUpdate(@Param("id") UUID id);

    Optional<Application> findByApplicationNumber(String applicationNumber);
}
