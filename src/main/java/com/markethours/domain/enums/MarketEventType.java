package com.markethours.domain.enums;

public enum MarketEventType {
    OPEN,
    CLOSE
}
