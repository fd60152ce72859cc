package com.example.donations.repository;

import com.example.donations.config.DonationProperties;
import com.example.donations.model.LifetimeGivingEntry;
import com.example.donations.model.LifetimeGivingSnapshot;
import com.example.donations.model.ProcessedFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tabela DonorLifetimeGiving e o registro dos arquivos já mesclados nela, guardados no
 * mesmo documento. Uma gravação substitui os dois de uma vez.
 */
@Repository
public class LifetimeGivingRepository {

    private static final Logger log = LoggerFactory.getLogger(LifetimeGivingRepository.class);

    static final String DATA_FILE_NAME = "data.json";

    private final ObjectMapper objectMapper;
    private final String tableName;
    private final Path dataFile;

    public LifetimeGivingRepository(ObjectMapper objectMapper, DonationProperties properties) {
        this.objectMapper = objectMapper;
        this.tableName = properties.getTable().getName();
        this.dataFile = properties.getTable().dataDirectory().resolve(DATA_FILE_NAME);
        log.info("LifetimeGivingRepository inicializado para a tabela {} em {}", tableName, dataFile);
    }

    public boolean exists() {
        return Files.exists(dataFile);
    }

    public Path getDataFile() {
        return dataFile;
    }

    /**
     * Lê a tabela atual junto com os arquivos já mesclados.
     *
     * @return O conteúdo gravado, ou vazio se a tabela ainda não existe.
     * @throws IOException Se o arquivo existe mas não pode ser lido, está corrompido ou
     *                     tem entradas inválidas. Nunca é tratado como tabela inexistente.
     */
    public Optional<LifetimeGivingSnapshot> load() throws IOException {
        if (!exists()) {
            log.info("Tabela {} não encontrada em {}.", tableName, dataFile);
            return Optional.empty();
        }

        LifetimeGivingSnapshot snapshot;
        try (InputStream in = Files.newInputStream(dataFile)) {
            snapshot = objectMapper.readValue(in, LifetimeGivingSnapshot.class);
        }
        if (snapshot == null || snapshot.getTable() == null) {
            throw new IOException("Arquivo da tabela " + tableName + " está vazio: " + dataFile);
        }
        if (snapshot.getProcessedFiles() == null) {
            snapshot.setProcessedFiles(new ArrayList<>());
        }
        validate(snapshot);

        log.info("Tabela {} carregada com {} doadores e {} arquivos processados.",
                tableName, snapshot.getTable().size(), snapshot.getProcessedFiles().size());
        return Optional.of(snapshot);
    }

    /**
     * Lê apenas as entradas da tabela atual.
     *
     * @return As entradas da tabela, ou vazio se a tabela ainda não existe.
     * @throws IOException Nas mesmas condições de {@link #load()}.
     */
    public Optional<List<LifetimeGivingEntry>> findAll() throws IOException {
        return load().map(snapshot -> Collections.unmodifiableList(snapshot.getTable()));
    }

    /**
     * Substitui a tabela e o registro de arquivos processados numa única gravação atômica.
     * O conteúdo anterior permanece intacto se a gravação falhar.
     *
     * @param snapshot A nova tabela completa com o registro completo de arquivos.
     * @throws IOException Se ocorrer um erro ao gravar.
     */
    public void save(LifetimeGivingSnapshot snapshot) throws IOException {
        log.info("Gravando tabela {} com {} doadores e {} arquivos processados em {}",
                tableName, snapshot.getTable().size(), snapshot.getProcessedFiles().size(), dataFile);
        JsonFiles.writeAtomically(objectMapper, dataFile, snapshot);
        log.info("Tabela {} atualizada com sucesso.", tableName);
    }

    private void validate(LifetimeGivingSnapshot snapshot) throws IOException {
        Set<Long> donorIds = new HashSet<>();
        for (LifetimeGivingEntry entry : snapshot.getTable()) {
            if (entry == null || entry.getDonorId() == null
                    || entry.getLifetimeAmount() == null || entry.getLastDonation() == null) {
                throw new IOException("Entrada incompleta na tabela " + tableName + ": " + entry);
            }
            if (!donorIds.add(entry.getDonorId())) {
                throw new IOException("DonorID duplicado na tabela " + tableName + ": " + entry.getDonorId());
            }
        }
        for (ProcessedFile processedFile : snapshot.getProcessedFiles()) {
            if (processedFile == null || processedFile.getFileId() == null) {
                throw new IOException("Registro de arquivo processado incompleto na tabela " + tableName
                        + ": " + processedFile);
            }
        }
    }
}
