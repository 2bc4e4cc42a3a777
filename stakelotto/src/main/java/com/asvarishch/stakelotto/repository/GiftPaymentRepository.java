package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.GiftPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GiftPaymentRepository extends JpaRepository<GiftPayment, Long> {

    List<GiftPayment> findByRoundIdOrderByPaymentIdAsc(Long roundId);
}
