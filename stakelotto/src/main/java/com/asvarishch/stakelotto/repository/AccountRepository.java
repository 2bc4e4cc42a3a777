package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountRepository extends JpaRepository<Account, String> {}
