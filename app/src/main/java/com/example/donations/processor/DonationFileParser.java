package com.example.donations.processor;

import com.example.donations.config.DonationProperties;
import com.example.donations.exception.DonationProcessingException;
import com.example.donations.exception.ProcessingStage;
import com.example.donations.model.DonationRecord;
import com.example.donations.model.RejectedRecord;
import com.example.donations.model.RejectionReason;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class DonationFileParser {

    private static final Logger log = LoggerFactory.getLogger(DonationFileParser.class);

    public static final String DONOR_ID_HEADER = "DonorID";
    public static final String NAME_HEADER = "Name";
    public static final String AMOUNT_HEADER = "Amount";
    public static final String DATE_HEADER = "Date";

    private static final List<String> REQUIRED_HEADERS = List.of(DONOR_ID_HEADER, NAME_HEADER, AMOUNT_HEADER, DATE_HEADER);

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final DateTimeFormatter dateFormatter;

    public DonationFileParser(DonationProperties properties) {
        this.dateFormatter = DateTimeFormatter.ofPattern(properties.getCsv().getDatePattern())
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Lê um arquivo CSV de doações.
     * Cada linha é validada individualmente: linhas inválidas são rejeitadas com o motivo
     * e o restante do arquivo continua sendo lido.
     *
     * @param fileName O nome do arquivo, usado nos logs e nas rejeições.
     * @param inputStream O conteúdo do arquivo. É fechado ao final.
     * @return As doações válidas e as linhas rejeitadas.
     * @throws DonationProcessingException Se o arquivo não puder ser lido ou não tiver os cabeçalhos obrigatórios.
     */
    public ParsedDonationFile parse(String fileName, InputStream inputStream) {
        log.info("Iniciando a leitura do arquivo CSV '{}'", fileName);
        ParsedDonationFile.ParsedDonationFileBuilder result = ParsedDonationFile.builder().fileName(fileName);
        int acceptedCount = 0;
        int rejectedCount = 0;

        try (Reader reader = openReader(inputStream);
             CSVParser csvParser = new CSVParser(reader, CSV_FORMAT)) {

            validateHeaders(fileName, csvParser.getHeaderMap());

            for (CSVRecord csvRecord : csvParser) {
                try {
                    result.record(parseCsvRecord(fileName, csvRecord));
                    acceptedCount++;
                } catch (InvalidDonationRecordException e) {
                    log.warn("Linha {} do arquivo '{}' rejeitada ({}): {}. Registro: {}",
                            csvRecord.getRecordNumber(), fileName, e.getReason(), e.getMessage(), csvRecord.toMap());
                    result.rejection(RejectedRecord.builder()
                            .sourceFile(fileName)
                            .recordNumber(csvRecord.getRecordNumber())
                            .reason(e.getReason())
                            .detail(e.getMessage())
                            .values(csvRecord.toMap())
                            .build());
                    rejectedCount++;
                }
            }
        } catch (IOException | UncheckedIOException e) {
            log.error("Erro de IO ao ler o arquivo CSV '{}': {}", fileName, e.getMessage(), e);
            throw new DonationProcessingException(ProcessingStage.READ_INPUT,
                    "Não foi possível ler o arquivo '" + fileName + "': " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            log.error("Estrutura inválida no arquivo CSV '{}': {}", fileName, e.getMessage(), e);
            throw new DonationProcessingException(ProcessingStage.READ_INPUT,
                    "Estrutura inválida no arquivo '" + fileName + "': " + e.getMessage(), e);
        }

        log.info("Leitura do arquivo '{}' concluída. Aceitas: {}, Rejeitadas: {}", fileName, acceptedCount, rejectedCount);
        return result.build();
    }

    private Reader openReader(InputStream inputStream) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        // BOM de arquivos salvos no Excel
        reader.mark(1);
        if (reader.read() != '\uFEFF') {
            reader.reset();
        }
        return reader;
    }

    private void validateHeaders(String fileName, Map<String, Integer> headerMap) {
        List<String> missing = REQUIRED_HEADERS.stream()
                .filter(header -> headerMap == null || !headerMap.containsKey(header))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new DonationProcessingException(ProcessingStage.READ_INPUT,
                    "Arquivo '" + fileName + "' sem os cabeçalhos obrigatórios " + missing
                            + ". Esperado: " + String.join(",", REQUIRED_HEADERS));
        }
    }

    /**
     * Converte um CSVRecord em DonationRecord, validando cada campo.
     * Valor zero é aceito; valores negativos não.
     */
    private DonationRecord parseCsvRecord(String fileName, CSVRecord record) {
        if (!record.isConsistent()) {
            throw new InvalidDonationRecordException(RejectionReason.INCONSISTENT_RECORD,
                    "Número de colunas (" + record.size() + ") diferente do cabeçalho");
        }

        String name = record.get(NAME_HEADER);
        return DonationRecord.builder()
                .donorId(parseDonorId(record.get(DONOR_ID_HEADER)))
                .name(name == null || name.isEmpty() ? null : name)
                .amount(parseAmount(record.get(AMOUNT_HEADER)))
                .date(parseDate(record.get(DATE_HEADER)))
                .sourceFile(fileName)
                .recordNumber(record.getRecordNumber())
                .build();
    }

    private long parseDonorId(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidDonationRecordException(RejectionReason.MISSING_DONOR_ID, "DonorID ausente");
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new InvalidDonationRecordException(RejectionReason.INVALID_DONOR_ID,
                    "DonorID não é um inteiro: '" + raw + "'", e);
        }
    }

    private BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidDonationRecordException(RejectionReason.MISSING_AMOUNT, "Amount ausente");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new InvalidDonationRecordException(RejectionReason.INVALID_AMOUNT,
                    "Amount não é numérico: '" + raw + "'", e);
        }
        if (amount.signum() < 0) {
            throw new InvalidDonationRecordException(RejectionReason.NEGATIVE_AMOUNT,
                    "Amount negativo: " + amount.toPlainString());
        }
        return amount;
    }

    private LocalDate parseDate(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidDonationRecordException(RejectionReason.MISSING_DATE, "Date ausente");
        }
        try {
            return LocalDate.parse(raw, dateFormatter);
        } catch (DateTimeParseException e) {
            throw new InvalidDonationRecordException(RejectionReason.INVALID_DATE,
                    "Date fora do formato esperado: '" + raw + "'", e);
        }
    }
}
