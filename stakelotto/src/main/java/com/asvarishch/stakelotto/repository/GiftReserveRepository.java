package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.GiftReserve;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface GiftReserveRepository extends JpaRepository<GiftReserve, Integer> {}
