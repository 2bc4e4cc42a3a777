package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.PlayerStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PlayerStatsRepository extends JpaRepository<PlayerStats, String> {

    List<PlayerStats> findByAddressIn(Collection<String> addresses);
}
