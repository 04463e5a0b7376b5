package com.paycycle.obligation.repository;

import com.paycycle.obligation.entity.Biller;
import com.paycycle.obligation.entity.BillerStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BillerRepository extends JpaRepository<Biller, UUID> {

    List<Biller> findByStatus(BillerStatus status);

    List<Biller> findByCategoryIgnoreCase(String category);

    List<Biller> findAllByOrderByNameAsc();
}
