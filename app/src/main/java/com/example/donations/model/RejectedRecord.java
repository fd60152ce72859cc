package com.example.donations.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Uma linha do CSV que não passou na validação, com o motivo da rejeição.
 */
@Data
@Builder
public class RejectedRecord {
    private String sourceFile;
    private long recordNumber;
    private RejectionReason reason;
    private String detail;
    private Map<String, String> values;
}
