package com.asvarishch.stakelotto.dto;

public record ErrorResponseDTO(
        String code,
        String category,
        String message
) {}
