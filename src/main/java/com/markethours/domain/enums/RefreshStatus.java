package com.markethours.domain.enums;

public enum RefreshStatus {
    SUCCESS,
    FAILURE
}
