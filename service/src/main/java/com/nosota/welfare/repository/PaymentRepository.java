package com.nosota.welfare.repository;

import com.nosota.welfare.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    List<Payment> findByApplicationIdOrderByCreatedAtAsc(UUID applicationId);

    boolean existsByApplicationId(UUID applicationId);
}
