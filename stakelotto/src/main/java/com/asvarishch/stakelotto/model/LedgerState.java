package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/** Singleton row with the token ledger's global counters. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "id", callSuper = false)
@Entity
@Table(name = "ledger_state")
public class LedgerState extends AuditableEntity<Integer> {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private Integer id;

    @Builder.Default
    @Column(name = "total_supply", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalSupply = TokenMath.ZERO;

    @Builder.Default
    @Column(name = "total_staked", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalStaked = TokenMath.ZERO;

    @Builder.Default
    @Column(name = "total_burned", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalBurned = TokenMath.ZERO;

    /** Lifts the minimum staking duration for unstaking and benefits. */
    @Column(name = "emergency_mode", nullable = false)
    private boolean emergencyMode;

    public static LedgerState initial() {
        return LedgerState.builder().id(SINGLETON_ID).build();
    }
}
