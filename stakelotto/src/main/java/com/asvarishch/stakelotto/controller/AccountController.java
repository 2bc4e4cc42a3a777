package com.asvarishch.stakelotto.controller;

import com.asvarishch.stakelotto.dto.AccountSnapshotDTO;
import com.asvarishch.stakelotto.service.LotteryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/accounts")
public class AccountController {

    private final LotteryQueryService queryService;

    @GetMapping("/{address}")
    public ResponseEntity<AccountSnapshotDTO> account(@PathVariable String address) {
        return ResponseEntity.ok(queryService.account(address));
    }
}
