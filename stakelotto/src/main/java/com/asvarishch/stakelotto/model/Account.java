package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Token holdings of one address. {@code balance} is everything the address holds, staked
 * capital included; {@code balance - stakedAmount} is what it may spend.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "address", callSuper = false)
@Entity
@Table(name = "accounts")
public class Account extends AuditableEntity<String> {

    @Id
    @Column(name = "address", length = 64, nullable = false)
    private String address;

    @Builder.Default
    @Column(name = "balance", precision = 38, scale = 18, nullable = false)
    private BigDecimal balance = TokenMath.ZERO;

    @Builder.Default
    @Column(name = "staked_amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal stakedAmount = TokenMath.ZERO;

    /** Reset on every stake; null while nothing has ever been staked. */
    @Column(name = "staking_started_at")
    private Instant stakingStartedAt;

    @Column(name = "is_authorized_burner", nullable = false)
    private boolean authorizedBurner;

    @Column(name = "is_authorized_transferor", nullable = false)
    private boolean authorizedTransferor;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public BigDecimal getAvailableBalance() {
        return TokenMath.subtract(balance, stakedAmount);
    }

    public static Account empty(String address) {
        return Account.builder().address(address).build();
    }
}
