package com.example.donations.exception;

/**
 * Falha fatal de uma execução. Indica em qual etapa o processamento parou.
 */
public class DonationProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ProcessingStage stage;

    public DonationProcessingException(ProcessingStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public DonationProcessingException(ProcessingStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public ProcessingStage getStage() {
        return stage;
    }
}
