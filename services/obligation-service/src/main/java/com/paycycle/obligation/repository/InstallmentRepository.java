package com.paycycle.obligation.repository;

import com.paycycle.obligation.entity.Installment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InstallmentRepository extends JpaRepository<Installment, UUID> {

    List<Installment> findByAccountId(String accountId);

    List<Installment> findByCategoryIgnoreCase(String category);

    List<Installment> findAllByOrderByNameAsc();
}
