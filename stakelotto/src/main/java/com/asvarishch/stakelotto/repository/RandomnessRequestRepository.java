package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.RandomnessRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RandomnessRequestRepository extends JpaRepository<RandomnessRequest, Long> {
}
