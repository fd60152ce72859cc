package com.example.donations.runner;

import com.example.donations.exception.DonationProcessingException;
import com.example.donations.model.ProcessingReport;
import com.example.donations.report.LifetimeGivingTableFormatter;
import com.example.donations.service.DonationBatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Modo padrão: uma única execução na inicialização da aplicação.
 * Uma falha interrompe a inicialização, e o processo termina com código diferente de zero.
 */
@Component
@ConditionalOnProperty(prefix = "donations.poller", name = "enabled", havingValue = "false", matchIfMissing = true)
public class DonationProcessingRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DonationProcessingRunner.class);

    private final DonationBatchService donationBatchService;
    private final LifetimeGivingTableFormatter tableFormatter;

    public DonationProcessingRunner(DonationBatchService donationBatchService,
                                    LifetimeGivingTableFormatter tableFormatter) {
        this.donationBatchService = donationBatchService;
        this.tableFormatter = tableFormatter;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Iniciando processamento dos arquivos de doações...");
        ProcessingReport report;
        try {
            report = donationBatchService.process();
        } catch (DonationProcessingException e) {
            log.error("Falha na etapa {} ({}): {}", e.getStage(), e.getStage().getDescription(), e.getMessage());
            throw e;
        }
        log.info("Processamento concluído.\n{}", tableFormatter.summarize(report));
        log.info("\n{}", tableFormatter.format(report.getTable()));
    }
}
