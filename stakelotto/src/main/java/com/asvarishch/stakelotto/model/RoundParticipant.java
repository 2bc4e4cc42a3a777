package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Membership of an address in a round's participant set. {@code joinOrder} preserves
 * insertion order; {@code totalBetAmount} backs the per-user-per-round bet cap.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "participantId", callSuper = false)
@Entity
@Table(
        name = "round_participants",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_participant_round_address", columnNames = {"round_id", "address"})
        },
        indexes = {
                @Index(name = "ix_participant_round_id", columnList = "round_id")
        }
)
public class RoundParticipant extends AuditableEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "participant_id")
    private Long participantId;

    @Column(name = "round_id", nullable = false)
    private Long roundId;

    @Column(name = "address", length = 64, nullable = false)
    private String address;

    @Column(name = "join_order", nullable = false)
    private int joinOrder;

    @Builder.Default
    @Column(name = "total_bet_amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalBetAmount = TokenMath.ZERO;
}
