package com.markethours.domain.enums;

public enum BoundaryDirection {
    NEXT_OPEN,
    NEXT_CLOSE
}
