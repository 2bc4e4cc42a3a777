package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.ScheduledOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduledOperationRepository extends JpaRepository<ScheduledOperation, String> {}
