package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/** Singleton reserve funding post-draw gifts. The balance never goes negative. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "id", callSuper = false)
@Entity
@Table(name = "gift_reserve")
public class GiftReserve extends AuditableEntity<Integer> {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private Integer id;

    @Builder.Default
    @Column(name = "balance", precision = 38, scale = 18, nullable = false)
    private BigDecimal balance = TokenMath.ZERO;

    @Column(name = "recipients_per_round", nullable = false)
    private int recipientsPerRound;

    @Column(name = "creator_amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal creatorAmount;

    @Column(name = "user_amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal userAmount;

    @Builder.Default
    @Column(name = "total_distributed", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalDistributed = TokenMath.ZERO;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /** creator_amount + recipients_per_round * user_amount. */
    public BigDecimal costPerRound() {
        return TokenMath.add(creatorAmount, TokenMath.mulDiv(userAmount, recipientsPerRound, 1));
    }
}
