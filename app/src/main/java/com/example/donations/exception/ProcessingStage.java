package com.example.donations.exception;

/**
 * Etapas de uma execução, na ordem em que acontecem.
 */
public enum ProcessingStage {
    READ_INPUT("leitura dos arquivos de entrada"),
    READ_PRIOR_TABLE("leitura da tabela existente"),
    MERGE("mesclagem"),
    WRITE_RESULT("gravação do resultado");

    private final String description;

    ProcessingStage(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
