package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.LedgerState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerStateRepository extends JpaRepository<LedgerState, Integer> {}
