package com.example.donations.repository;

import com.example.donations.config.DonationProperties;
import com.example.donations.model.RejectedRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Repository
public class RejectedRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(RejectedRecordRepository.class);

    private final ObjectMapper objectMapper;
    private final Path rejectedDirectory;

    public RejectedRecordRepository(ObjectMapper objectMapper, DonationProperties properties) {
        this.objectMapper = objectMapper;
        this.rejectedDirectory = Path.of(properties.getIntake().getRejectedDirectory());
    }

    /**
     * Descarrega uma linha rejeitada como documento JSON no diretório de rejeitados.
     * Falhas são apenas registradas no log: não interrompem o processamento do lote.
     *
     * @param rejectedRecord A linha rejeitada.
     * @return O arquivo gravado, ou null se não foi possível gravar.
     */
    public Path save(RejectedRecord rejectedRecord) {
        try {
            Files.createDirectories(rejectedDirectory);
            Path target = rejectedDirectory.resolve(String.format("%s_%d_%s.json",
                    rejectedRecord.getSourceFile().replace(".csv", ""),
                    rejectedRecord.getRecordNumber(),
                    UUID.randomUUID()));

            Map<String, Object> rejectedData = new LinkedHashMap<>();
            if (rejectedRecord.getValues() != null) {
                rejectedData.putAll(rejectedRecord.getValues());
            }
            rejectedData.put("_rejectionReason", rejectedRecord.getReason());
            rejectedData.put("_rejectionDetail", rejectedRecord.getDetail());
            rejectedData.put("_originalFileName", rejectedRecord.getSourceFile());
            rejectedData.put("_recordNumber", rejectedRecord.getRecordNumber());
            rejectedData.put("_rejectionTimestamp", Instant.now().toString());

            Files.writeString(target, objectMapper.writeValueAsString(rejectedData), StandardCharsets.UTF_8);
            log.info("Registro rejeitado salvo em {}", target);
            return target;
        } catch (JsonProcessingException e) {
            log.error("Erro ao serializar registro rejeitado para JSON. Registro: {}", rejectedRecord, e);
        } catch (IOException e) {
            log.error("Erro ao salvar registro rejeitado no diretório {}. Registro: {}", rejectedDirectory, rejectedRecord, e);
        }
        return null;
    }
}
