package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.EngineState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EngineStateRepository extends JpaRepository<EngineState, Integer> {}
