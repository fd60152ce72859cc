package com.example.donations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registro de um arquivo de doações já mesclado na tabela.
 * O {@code fileId} é o hash SHA-256 do conteúdo, de modo que o mesmo arquivo
 * reenviado com outro nome ainda é reconhecido.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedFile {

    private String fileId;
    private String fileName;
    private Instant processedTimestamp;
    private String status;
    private int acceptedRecords;
    private int rejectedRecords;
}
