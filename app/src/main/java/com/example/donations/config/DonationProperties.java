package com.example.donations.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.Locale;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "donations")
public class DonationProperties {

    @Valid
    private Intake intake = new Intake();

    @Valid
    private Csv csv = new Csv();

    @Valid
    private Table table = new Table();

    @Valid
    private Merge merge = new Merge();

    @Valid
    private Report report = new Report();

    @Valid
    private Poller poller = new Poller();

    @Data
    public static class Intake {

        @NotBlank(message = "O diretório de entrada não pode estar em branco.")
        private String directory = "Incoming";

        @NotBlank(message = "O padrão de arquivos de entrada não pode estar em branco.")
        private String fileGlob = "*.csv";

        @NotBlank(message = "O diretório de arquivos processados não pode estar em branco.")
        private String archiveDirectory = "Incoming/processed";

        @NotBlank(message = "O diretório de linhas rejeitadas não pode estar em branco.")
        private String rejectedDirectory = "Incoming/rejected";

        @NotBlank(message = "O diretório de arquivos duplicados não pode estar em branco.")
        private String duplicatesDirectory = "Incoming/duplicates";

        private boolean skipAlreadyProcessed = true;

        private boolean archiveProcessedFiles = true;
    }

    @Data
    public static class Csv {

        @NotBlank(message = "O formato de data do CSV não pode estar em branco.")
        private String datePattern = "M/d/uuuu";
    }

    @Data
    public static class Table {

        @NotBlank(message = "O nome da tabela não pode estar em branco.")
        private String name = "DonorLifetimeGiving";

        @NotBlank(message = "O diretório do warehouse não pode estar em branco.")
        private String warehouseDirectory = "warehouse";

        /**
         * Diretório da tabela: {@code <warehouse>/<nome em minúsculas>}.
         */
        public Path dataDirectory() {
            return Path.of(warehouseDirectory, name.toLowerCase(Locale.ROOT));
        }
    }

    @Data
    public static class Merge {
        private boolean parallel = false;
    }

    @Data
    public static class Report {

        @Min(value = 1, message = "O limite do relatório deve ser pelo menos 1.")
        private int limit = 20;
    }

    @Data
    public static class Poller {
        private boolean enabled = false;
        private String cron = "0 */5 * * * *";
    }
}
