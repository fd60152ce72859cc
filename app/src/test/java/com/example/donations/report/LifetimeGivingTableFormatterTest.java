package com.example.donations.report;

import com.example.donations.config.DonationProperties;
import com.example.donations.model.LifetimeGivingEntry;
import com.example.donations.model.ProcessingReport;
import com.example.donations.model.RejectedRecord;
import com.example.donations.model.RejectionReason;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LifetimeGivingTableFormatterTest {

    @Test
    void format_shouldOrderByDonorIdAndShowTotal() {
        LifetimeGivingTableFormatter formatter = new LifetimeGivingTableFormatter(new DonationProperties());

        String output = formatter.format(List.of(
                new LifetimeGivingEntry(2L, "Jane Smith", new BigDecimal("10"), LocalDate.of(2026, 1, 3)),
                new LifetimeGivingEntry(1L, "Joe Smith", new BigDecimal("8.50"), LocalDate.of(2026, 1, 5))));

        assertThat(output).contains("Contents of DonorLifetimeGiving:");
        assertThat(output).contains("|DonorID|Name      |LifetimeAmount|LastDonation|");
        assertThat(output).contains("|1      |Joe Smith |8.50          |2026-01-05  |");
        assertThat(output.indexOf("Joe Smith")).isLessThan(output.indexOf("Jane Smith"));
        assertThat(output).endsWith("Total records: 2");
        assertThat(output).doesNotContain("only showing");
    }

    @Test
    void format_shouldLimitRows() {
        DonationProperties properties = new DonationProperties();
        properties.getReport().setLimit(2);
        LifetimeGivingTableFormatter formatter = new LifetimeGivingTableFormatter(properties);
        List<LifetimeGivingEntry> table = new ArrayList<>();
        for (long id = 1; id <= 5; id++) {
            table.add(new LifetimeGivingEntry(id, "Donor " + id, BigDecimal.ONE, LocalDate.of(2026, 1, 1)));
        }

        String output = formatter.format(table);

        assertThat(output).contains("Donor 1", "Donor 2", "only showing top 2 rows", "Total records: 5");
        assertThat(output).doesNotContain("Donor 3");
    }

    @Test
    void summarize_shouldListEachRejectedRow() {
        LifetimeGivingTableFormatter formatter = new LifetimeGivingTableFormatter(new DonationProperties());
        ProcessingReport report = ProcessingReport.builder()
                .mergedFile("jan.csv")
                .acceptedRecords(2)
                .rejectedRecord(RejectedRecord.builder()
                        .sourceFile("jan.csv")
                        .recordNumber(2)
                        .reason(RejectionReason.INVALID_AMOUNT)
                        .detail("Amount não é numérico: 'ten'")
                        .build())
                .table(List.of())
                .tableUpdated(true)
                .build();

        String summary = formatter.summarize(report);

        assertThat(summary)
                .contains("Arquivos mesclados: 1 [jan.csv]")
                .contains("Linhas aceitas: 2")
                .contains("Linhas rejeitadas: 1")
                .contains("jan.csv linha 2 [INVALID_AMOUNT] Amount não é numérico: 'ten'")
                .contains("Tabela atualizada.");
    }
}
