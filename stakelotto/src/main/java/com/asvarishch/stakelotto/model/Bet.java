package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.model.converter.LotteryNumbersConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One wager, addressed by (roundId, betIndex). Written three times at most:
 * on placement, when the draw sets {@code matchCount}, and when claimed.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "betId", callSuper = false)
@Entity
@Table(
        name = "bets",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_bet_round_index", columnNames = {"round_id", "bet_index"})
        },
        indexes = {
                @Index(name = "ix_bet_round_id", columnList = "round_id"),
                @Index(name = "ix_bet_bettor", columnList = "bettor")
        }
)
public class Bet extends AuditableEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "bet_id")
    private Long betId;

    @Column(name = "round_id", nullable = false)
    private Long roundId;

    /** Position within the round, from 0. */
    @Column(name = "bet_index", nullable = false)
    private int betIndex;

    @Column(name = "bettor", length = 64, nullable = false)
    private String bettor;

    @Builder.Default
    @Convert(converter = LotteryNumbersConverter.class)
    @Column(name = "numbers", length = 32, nullable = false)
    private List<Integer> numbers = new ArrayList<>();

    @Column(name = "amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal amount;

    @Column(name = "placed_at", nullable = false)
    private Instant placedAt;

    @Column(name = "match_count", nullable = false)
    private int matchCount;

    @Column(name = "claimed", nullable = false)
    private boolean claimed;
}
