package com.example.donations.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Conteúdo gravado em disco: a tabela DonorLifetimeGiving junto com o registro dos arquivos
 * já mesclados nela. Os dois são gravados na mesma operação, de modo que um arquivo só
 * aparece como processado se as suas doações estão na tabela.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LifetimeGivingSnapshot {

    @Builder.Default
    private List<LifetimeGivingEntry> table = new ArrayList<>();

    @Builder.Default
    private List<ProcessedFile> processedFiles = new ArrayList<>();

    public static LifetimeGivingSnapshot empty() {
        return LifetimeGivingSnapshot.builder().build();
    }

    public boolean isProcessed(String fileId) {
        return processedFiles.stream().anyMatch(file -> fileId.equals(file.getFileId()));
    }
}
