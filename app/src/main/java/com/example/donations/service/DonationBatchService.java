package com.example.donations.service;

import com.example.donations.config.DonationProperties;
import com.example.donations.exception.DonationProcessingException;
import com.example.donations.exception.ProcessingStage;
import com.example.donations.intake.IncomingFileLocator;
import com.example.donations.merge.LifetimeGivingMerger;
import com.example.donations.model.DonationRecord;
import com.example.donations.model.LifetimeGivingEntry;
import com.example.donations.model.LifetimeGivingSnapshot;
import com.example.donations.model.ProcessedFile;
import com.example.donations.model.ProcessingReport;
import com.example.donations.model.RejectedRecord;
import com.example.donations.processor.DonationFileParser;
import com.example.donations.processor.ParsedDonationFile;
import com.example.donations.repository.LifetimeGivingRepository;
import com.example.donations.repository.RejectedRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executa um ciclo completo: lê os CSVs pendentes, carrega a tabela atual, mescla e grava
 * a nova tabela junto com o registro dos arquivos mesclados. Execuções no mesmo processo
 * são serializadas; o serviço não protege contra outro processo gravando a mesma tabela.
 */
@Service
public class DonationBatchService {

    private static final Logger log = LoggerFactory.getLogger(DonationBatchService.class);

    private final IncomingFileLocator incomingFileLocator;
    private final DonationFileParser donationFileParser;
    private final LifetimeGivingMerger lifetimeGivingMerger;
    private final LifetimeGivingRepository lifetimeGivingRepository;
    private final RejectedRecordRepository rejectedRecordRepository;
    private final boolean skipAlreadyProcessed;
    private final boolean archiveProcessedFiles;

    private final ReentrantLock runLock = new ReentrantLock();

    public DonationBatchService(IncomingFileLocator incomingFileLocator,
                                DonationFileParser donationFileParser,
                                LifetimeGivingMerger lifetimeGivingMerger,
                                LifetimeGivingRepository lifetimeGivingRepository,
                                RejectedRecordRepository rejectedRecordRepository,
                                DonationProperties properties) {
        this.incomingFileLocator = incomingFileLocator;
        this.donationFileParser = donationFileParser;
        this.lifetimeGivingMerger = lifetimeGivingMerger;
        this.lifetimeGivingRepository = lifetimeGivingRepository;
        this.rejectedRecordRepository = rejectedRecordRepository;
        this.skipAlreadyProcessed = properties.getIntake().isSkipAlreadyProcessed();
        this.archiveProcessedFiles = properties.getIntake().isArchiveProcessedFiles();
    }

    /**
     * Processa todos os arquivos pendentes e atualiza a tabela.
     * Sem linhas válidas, a tabela não é regravada.
     *
     * @return O resumo da execução com a tabela resultante.
     * @throws DonationProcessingException Se alguma etapa falhar; indica a etapa.
     */
    public ProcessingReport process() {
        runLock.lock();
        try {
            return doProcess();
        } finally {
            runLock.unlock();
        }
    }

    private ProcessingReport doProcess() {
        ProcessingReport.ProcessingReportBuilder report = ProcessingReport.builder();

        Map<Path, byte[]> contents = readIncomingFiles();
        LifetimeGivingSnapshot prior = readPriorTable();

        List<Path> duplicates = new ArrayList<>();
        Map<Path, FileBatch> batches = parseNewFiles(contents, prior, duplicates, report);
        List<DonationRecord> records = new ArrayList<>();
        for (FileBatch batch : batches.values()) {
            records.addAll(batch.parsed.getRecords());
            report.rejectedRecords(batch.parsed.getRejections());
            report.mergedFile(batch.parsed.getFileName());
        }
        report.acceptedRecords(records.size());

        List<LifetimeGivingEntry> table;
        if (records.isEmpty()) {
            log.info("Nenhuma doação válida nos arquivos de entrada. A tabela permanece inalterada.");
            table = prior.getTable();
            report.tableUpdated(false);
        } else {
            log.info("Mesclando {} doações de {} arquivos com a tabela existente ({} doadores)...",
                    records.size(), batches.size(), prior.getTable().size());
            table = merge(prior.getTable(), records);
            writeSnapshot(prior, table, batches);
            report.tableUpdated(true);
        }

        completeIntake(batches, duplicates);
        return report.table(table).build();
    }

    private Map<Path, byte[]> readIncomingFiles() {
        List<Path> files;
        try {
            files = incomingFileLocator.listCsvFiles();
        } catch (IOException e) {
            throw new DonationProcessingException(ProcessingStage.READ_INPUT,
                    "Não foi possível listar o diretório de entrada: " + e.getMessage(), e);
        }

        Map<Path, byte[]> contents = new LinkedHashMap<>();
        for (Path file : files) {
            try (InputStream in = incomingFileLocator.openFile(file)) {
                contents.put(file, in.readAllBytes());
            } catch (IOException e) {
                log.error("Erro de IO ao ler o arquivo {}: {}", file.getFileName(), e.getMessage(), e);
                throw new DonationProcessingException(ProcessingStage.READ_INPUT,
                        "Não foi possível ler o arquivo '" + file.getFileName() + "': " + e.getMessage(), e);
            }
        }
        return contents;
    }

    private Map<Path, FileBatch> parseNewFiles(Map<Path, byte[]> contents, LifetimeGivingSnapshot prior,
                                               List<Path> duplicates,
                                               ProcessingReport.ProcessingReportBuilder report) {
        Map<Path, FileBatch> batches = new LinkedHashMap<>();
        Set<String> seenInThisRun = new HashSet<>();
        for (Map.Entry<Path, byte[]> content : contents.entrySet()) {
            Path file = content.getKey();
            String fileName = file.getFileName().toString();
            String fileId = sha256(content.getValue());
            if (skipAlreadyProcessed && (!seenInThisRun.add(fileId) || prior.isProcessed(fileId))) {
                log.warn("Arquivo {} (ID: {}) já foi processado. Pulando.", fileName, fileId);
                report.skippedFile(fileName);
                duplicates.add(file);
                continue;
            }

            ParsedDonationFile parsed = donationFileParser.parse(fileName, new ByteArrayInputStream(content.getValue()));
            batches.put(file, new FileBatch(fileId, parsed));
        }
        return batches;
    }

    private LifetimeGivingSnapshot readPriorTable() {
        try {
            return lifetimeGivingRepository.load().orElseGet(() -> {
                log.info("Nenhuma tabela existente. A tabela será criada a partir dos arquivos de entrada.");
                return LifetimeGivingSnapshot.empty();
            });
        } catch (IOException e) {
            log.error("Erro ao ler a tabela existente {}: {}", lifetimeGivingRepository.getDataFile(), e.getMessage(), e);
            throw new DonationProcessingException(ProcessingStage.READ_PRIOR_TABLE,
                    "Não foi possível ler a tabela existente em " + lifetimeGivingRepository.getDataFile()
                            + ": " + e.getMessage(), e);
        }
    }

    private List<LifetimeGivingEntry> merge(List<LifetimeGivingEntry> priorTable, List<DonationRecord> records) {
        try {
            return lifetimeGivingMerger.mergeBatch(priorTable, records);
        } catch (RuntimeException e) {
            throw new DonationProcessingException(ProcessingStage.MERGE, e.getMessage(), e);
        }
    }

    /**
     * Grava a nova tabela e os arquivos desta execução no mesmo documento: ou os dois
     * ficam registrados, ou nenhum.
     */
    private void writeSnapshot(LifetimeGivingSnapshot prior, List<LifetimeGivingEntry> table,
                               Map<Path, FileBatch> batches) {
        List<ProcessedFile> processedFiles = new ArrayList<>(prior.getProcessedFiles());
        for (FileBatch batch : batches.values()) {
            processedFiles.add(ProcessedFile.builder()
                    .fileId(batch.fileId)
                    .fileName(batch.parsed.getFileName())
                    .processedTimestamp(Instant.now())
                    .status("SUCCESS")
                    .acceptedRecords(batch.parsed.getRecords().size())
                    .rejectedRecords(batch.parsed.getRejections().size())
                    .build());
        }

        try {
            lifetimeGivingRepository.save(LifetimeGivingSnapshot.builder()
                    .table(table)
                    .processedFiles(processedFiles)
                    .build());
        } catch (IOException e) {
            log.error("Erro ao gravar a tabela {}: {}", lifetimeGivingRepository.getDataFile(), e.getMessage(), e);
            throw new DonationProcessingException(ProcessingStage.WRITE_RESULT,
                    "Não foi possível gravar a tabela; a versão anterior foi mantida: " + e.getMessage(), e);
        }
        for (FileBatch batch : batches.values()) {
            log.info("Arquivo {} registrado como processado (ID: {}).", batch.parsed.getFileName(), batch.fileId);
        }
    }

    /**
     * Descarrega as linhas rejeitadas e tira os arquivos do diretório de entrada: os lidos
     * vão para processados, os pulados para duplicados. Só é chamado depois que a tabela
     * foi gravada.
     */
    private void completeIntake(Map<Path, FileBatch> batches, List<Path> duplicates) {
        for (FileBatch batch : batches.values()) {
            for (RejectedRecord rejected : batch.parsed.getRejections()) {
                rejectedRecordRepository.save(rejected);
            }
        }

        try {
            if (archiveProcessedFiles) {
                for (Path file : batches.keySet()) {
                    incomingFileLocator.archiveFile(file);
                }
            }
            for (Path file : duplicates) {
                incomingFileLocator.moveToDuplicates(file);
            }
        } catch (IOException e) {
            log.error("Erro ao mover os arquivos de entrada: {}", e.getMessage(), e);
            throw new DonationProcessingException(ProcessingStage.WRITE_RESULT,
                    "A tabela foi gravada, mas não foi possível mover os arquivos de entrada: "
                            + e.getMessage(), e);
        }
    }

    static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 não disponível", e);
        }
    }

    private static final class FileBatch {
        private final String fileId;
        private final ParsedDonationFile parsed;

        private FileBatch(String fileId, ParsedDonationFile parsed) {
            this.fileId = fileId;
            this.parsed = parsed;
        }
    }
}
