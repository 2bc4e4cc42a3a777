package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Participation statistics of one address, owned by the round engine.
 * Round ids start at 1, so 0 means "never".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "address", callSuper = false)
@Entity
@Table(name = "player_stats")
public class PlayerStats extends AuditableEntity<String> {

    @Id
    @Column(name = "address", length = 64, nullable = false)
    private String address;

    /** Cumulative amount wagered. */
    @Builder.Default
    @Column(name = "total_bets", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalBets = TokenMath.ZERO;

    @Column(name = "bet_count", nullable = false)
    private long betCount;

    @Builder.Default
    @Column(name = "total_winnings", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalWinnings = TokenMath.ZERO;

    @Column(name = "consecutive_rounds", nullable = false)
    private int consecutiveRounds;

    @Column(name = "last_participated_round", nullable = false)
    private long lastParticipatedRound;

    @Column(name = "last_gift_round", nullable = false)
    private long lastGiftRound;

    @Column(name = "is_eligible_for_gift", nullable = false)
    private boolean eligibleForGift;

    public static PlayerStats empty(String address) {
        return PlayerStats.builder().address(address).build();
    }
}
