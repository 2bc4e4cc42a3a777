package com.asvarishch.stakelotto.controller;

import com.asvarishch.stakelotto.dto.GiftPaymentDTO;
import com.asvarishch.stakelotto.dto.GiftReserveDTO;
import com.asvarishch.stakelotto.service.LotteryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/gifts")
public class GiftController {

    private final LotteryQueryService queryService;

    @GetMapping("/reserve")
    public ResponseEntity<GiftReserveDTO> reserve() {
        return ResponseEntity.ok(queryService.giftReserve());
    }

    @GetMapping("/rounds/{roundId}")
    public ResponseEntity<List<GiftPaymentDTO>> payments(@PathVariable long roundId) {
        return ResponseEntity.ok(queryService.giftPayments(roundId));
    }
}
