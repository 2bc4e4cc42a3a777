package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.Allowance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AllowanceRepository extends JpaRepository<Allowance, Long> {

    Optional<Allowance> findByOwnerAndSpender(String owner, String spender);
}
