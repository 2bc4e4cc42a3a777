package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.model.Round;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds singletons on startup: serial lock row, owner roles, ledger totals, gift reserve, engine state.
 * Opens round 1 unless {@code lottery.rounds.auto-initialize=false}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LotteryBootstrap {

    private final CallGuard callGuard;
    private final AccessControlService accessControl;
    private final TokenLedgerService tokenLedger;
    private final GiftDistributionService giftDistributionService;
    private final RoundService roundService;
    private final LotteryProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        callGuard.seed();
        accessControl.bootstrap(properties.getAccess().getBootstrapOwner());
        tokenLedger.initialize();
        giftDistributionService.initialize();
        if (!properties.getRounds().isAutoInitialize()) {
            log.debug("[BOOT] Round auto-initialize disabled; waiting for an explicit initialize");
            return;
        }
        final Round current = roundService.initialize();
        log.info("[BOOT] Engine ready, current round={}, ends={}", current.getRoundId(), current.getEndTime());
    }
}
