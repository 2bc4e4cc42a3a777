package com.asvarishch.stakelotto.controller;

import com.asvarishch.stakelotto.dto.BetSnapshotDTO;
import com.asvarishch.stakelotto.dto.ClaimableWinningsDTO;
import com.asvarishch.stakelotto.dto.RoundSnapshotDTO;
import com.asvarishch.stakelotto.service.LotteryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GET /api/rounds/current
 * GET /api/rounds/{roundId}
 * GET /api/rounds/{roundId}/bets/{betIndex}
 * GET /api/rounds/{roundId}/claimable/{address}
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/rounds")
public class RoundController {

    private final LotteryQueryService queryService;

    @GetMapping("/current")
    public ResponseEntity<RoundSnapshotDTO> currentRound() {
        return ResponseEntity.ok(queryService.currentRound());
    }

    @GetMapping("/{roundId}")
    public ResponseEntity<RoundSnapshotDTO> round(@PathVariable long roundId) {
        return ResponseEntity.ok(queryService.round(roundId));
    }

    @GetMapping("/{roundId}/bets/{betIndex}")
    public ResponseEntity<BetSnapshotDTO> bet(@PathVariable long roundId, @PathVariable int betIndex) {
        return ResponseEntity.ok(queryService.bet(roundId, betIndex));
    }

    @GetMapping("/{roundId}/claimable/{address}")
    public ResponseEntity<ClaimableWinningsDTO> claimable(@PathVariable long roundId, @PathVariable String address) {
        return ResponseEntity.ok(queryService.claimable(roundId, address));
    }
}
