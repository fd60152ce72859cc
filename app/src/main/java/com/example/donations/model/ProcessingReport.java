package com.example.donations.model;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Resultado de uma execução: arquivos lidos, linhas aceitas e rejeitadas e a tabela resultante.
 */
@Data
@Builder
public class ProcessingReport {
    @Singular
    private List<String> mergedFiles;
    @Singular
    private List<String> skippedFiles;
    private int acceptedRecords;
    @Singular
    private List<RejectedRecord> rejectedRecords;
    private List<LifetimeGivingEntry> table;
    private boolean tableUpdated;
}
