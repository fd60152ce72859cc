package com.example.donations.model;

public enum RejectionReason {
    MISSING_DONOR_ID,
    INVALID_DONOR_ID,
    MISSING_DATE,
    INVALID_DATE,
    MISSING_AMOUNT,
    INVALID_AMOUNT,
    NEGATIVE_AMOUNT,
    INCONSISTENT_RECORD
}
