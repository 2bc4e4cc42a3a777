package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.Bet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BetRepository extends JpaRepository<Bet, Long> {

    Optional<Bet> findByRoundIdAndBetIndex(Long roundId, int betIndex);

    List<Bet> findByRoundIdOrderByBetIndexAsc(Long roundId);

    List<Bet> findByRoundIdAndBettorOrderByBetIndexAsc(Long roundId, String bettor);

    // Winning bets already paid in a round; input for the per-round payout cap.
    @Query("""
             SELECT b
             FROM Bet b
             WHERE b.roundId = :roundId
               AND b.claimed = true
               AND b.matchCount >= :minMatches
             ORDER BY b.betIndex
            """)
    List<Bet> findClaimedWinningBets(@Param("roundId") Long roundId, @Param("minMatches") int minMatches);
}
