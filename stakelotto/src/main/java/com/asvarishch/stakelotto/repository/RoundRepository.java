package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.Round;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RoundRepository extends JpaRepository<Round, Long> {}
