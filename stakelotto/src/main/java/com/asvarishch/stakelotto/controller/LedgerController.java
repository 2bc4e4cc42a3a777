package com.asvarishch.stakelotto.controller;

import com.asvarishch.stakelotto.dto.LedgerSnapshotDTO;
import com.asvarishch.stakelotto.dto.ScheduledOperationDTO;
import com.asvarishch.stakelotto.service.LotteryQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class LedgerController {

    private final LotteryQueryService queryService;

    @GetMapping("/ledger")
    public ResponseEntity<LedgerSnapshotDTO> ledger() {
        return ResponseEntity.ok(queryService.ledger());
    }

    @GetMapping("/admin/operations")
    public ResponseEntity<List<ScheduledOperationDTO>> scheduledOperations() {
        return ResponseEntity.ok(queryService.scheduledOperations());
    }
}
