package com.example.donations.poller;

import com.example.donations.exception.DonationProcessingException;
import com.example.donations.model.ProcessingReport;
import com.example.donations.report.LifetimeGivingTableFormatter;
import com.example.donations.service.DonationBatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "donations.poller", name = "enabled", havingValue = "true")
public class IncomingDonationsPoller {

    private static final Logger log = LoggerFactory.getLogger(IncomingDonationsPoller.class);

    private final DonationBatchService donationBatchService;
    private final LifetimeGivingTableFormatter tableFormatter;

    public IncomingDonationsPoller(DonationBatchService donationBatchService,
                                   LifetimeGivingTableFormatter tableFormatter) {
        this.donationBatchService = donationBatchService;
        this.tableFormatter = tableFormatter;
    }

    @Scheduled(cron = "${donations.poller.cron:0 */5 * * * *}")
    public void pollIncomingDirectory() {
        log.info("Iniciando verificação agendada do diretório de entrada por arquivos CSV...");
        try {
            ProcessingReport report = donationBatchService.process();
            if (report.getMergedFiles().isEmpty()) {
                log.info("Nenhum novo arquivo CSV encontrado para processar.");
            } else {
                log.info("Processamento concluído.\n{}", tableFormatter.summarize(report));
                log.info("\n{}", tableFormatter.format(report.getTable()));
            }
        } catch (DonationProcessingException e) {
            log.error("Falha na etapa {} ({}): {}. Os arquivos permanecem no diretório de entrada.",
                    e.getStage(), e.getStage().getDescription(), e.getMessage(), e);
        } catch (Exception e) {
            log.error("Erro inesperado durante a verificação do diretório de entrada: {}", e.getMessage(), e);
        }
        log.info("Verificação agendada do diretório de entrada concluída.");
    }
}
