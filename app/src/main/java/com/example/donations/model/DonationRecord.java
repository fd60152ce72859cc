package com.example.donations.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Representa uma doação como lida de uma linha válida do arquivo CSV.
 * Guarda também a origem da linha (arquivo e número do registro) para rastreabilidade.
 */
@Data
@Builder
public class DonationRecord {
    private long donorId;
    private String name;
    private BigDecimal amount;
    private LocalDate date;
    private String sourceFile;
    private long recordNumber;
}
