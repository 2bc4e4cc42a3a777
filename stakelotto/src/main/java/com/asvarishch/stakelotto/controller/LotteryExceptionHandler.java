package com.asvarishch.stakelotto.controller;

import com.asvarishch.stakelotto.dto.ErrorResponseDTO;
import com.asvarishch.stakelotto.exception.ErrorCategory;
import com.asvarishch.stakelotto.exception.LotteryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class LotteryExceptionHandler {

    @ExceptionHandler(LotteryException.class)
    public ResponseEntity<ErrorResponseDTO> handle(LotteryException ex) {
        log.debug("Request failed: code={}, message={}", ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(statusFor(ex.getCategory()))
                .body(new ErrorResponseDTO(ex.getCode().name(), ex.getCategory().name(), ex.getMessage()));
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case ELIGIBILITY, CAPACITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STATE -> HttpStatus.CONFLICT;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}
