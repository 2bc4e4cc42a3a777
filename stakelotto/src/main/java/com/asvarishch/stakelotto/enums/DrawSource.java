package com.asvarishch.stakelotto.enums;

public enum DrawSource {
    ORACLE,
    EMERGENCY
}
