package com.example.donations.processor;

import com.example.donations.model.RejectionReason;

/**
 * Uma linha do CSV inválida. Recuperável: a linha é rejeitada e o lote continua.
 */
class InvalidDonationRecordException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final RejectionReason reason;

    InvalidDonationRecordException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    InvalidDonationRecordException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    RejectionReason getReason() {
        return reason;
    }
}
