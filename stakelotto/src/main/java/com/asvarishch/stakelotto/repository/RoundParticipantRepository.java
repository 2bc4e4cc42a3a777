package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.RoundParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoundParticipantRepository extends JpaRepository<RoundParticipant, Long> {

    Optional<RoundParticipant> findByRoundIdAndAddress(Long roundId, String address);

    List<RoundParticipant> findByRoundIdOrderByJoinOrderAsc(Long roundId);

    int countByRoundId(Long roundId);
}
