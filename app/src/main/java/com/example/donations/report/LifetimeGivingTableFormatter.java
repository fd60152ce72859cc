package com.example.donations.report;

import com.example.donations.config.DonationProperties;
import com.example.donations.model.LifetimeGivingEntry;
import com.example.donations.model.ProcessingReport;
import com.example.donations.model.RejectedRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Monta a tabela DonorLifetimeGiving em texto: ordenada por DonorID, com no máximo
 * {@code donations.report.limit} linhas e o total de registros ao final.
 */
@Component
public class LifetimeGivingTableFormatter {

    private static final String[] HEADERS = {"DonorID", "Name", "LifetimeAmount", "LastDonation"};

    private final String tableName;
    private final int limit;

    public LifetimeGivingTableFormatter(DonationProperties properties) {
        this.tableName = properties.getTable().getName();
        this.limit = properties.getReport().getLimit();
    }

    /**
     * Resumo de uma execução: arquivos, contagens e cada linha rejeitada com o motivo.
     */
    public String summarize(ProcessingReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Arquivos mesclados: ").append(report.getMergedFiles().size());
        if (!report.getMergedFiles().isEmpty()) {
            out.append(' ').append(report.getMergedFiles());
        }
        out.append('\n').append("Arquivos ignorados (já processados): ").append(report.getSkippedFiles().size());
        if (!report.getSkippedFiles().isEmpty()) {
            out.append(' ').append(report.getSkippedFiles());
        }
        out.append('\n').append("Linhas aceitas: ").append(report.getAcceptedRecords());
        out.append('\n').append("Linhas rejeitadas: ").append(report.getRejectedRecords().size());
        for (RejectedRecord rejected : report.getRejectedRecords()) {
            out.append('\n').append("  ").append(rejected.getSourceFile())
                    .append(" linha ").append(rejected.getRecordNumber())
                    .append(" [").append(rejected.getReason()).append("] ")
                    .append(rejected.getDetail());
        }
        out.append('\n').append(report.isTableUpdated() ? "Tabela atualizada." : "Tabela inalterada.");
        return out.toString();
    }

    public String format(List<LifetimeGivingEntry> table) {
        List<String[]> rows = new ArrayList<>();
        table.stream()
                .sorted(Comparator.comparingLong(LifetimeGivingEntry::getDonorId))
                .limit(limit)
                .forEach(entry -> rows.add(new String[]{
                        String.valueOf(entry.getDonorId()),
                        entry.getName() == null ? "null" : entry.getName(),
                        entry.getLifetimeAmount().toPlainString(),
                        entry.getLastDonation().toString()
                }));

        int[] widths = new int[HEADERS.length];
        for (int i = 0; i < HEADERS.length; i++) {
            widths[i] = HEADERS[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        String separator = separator(widths);
        StringBuilder out = new StringBuilder();
        out.append("=".repeat(60)).append('\n');
        out.append("Contents of ").append(tableName).append(":\n");
        out.append("=".repeat(60)).append('\n');
        out.append(separator);
        appendRow(out, HEADERS, widths);
        out.append(separator);
        for (String[] row : rows) {
            appendRow(out, row, widths);
        }
        out.append(separator);
        if (table.size() > rows.size()) {
            out.append("only showing top ").append(rows.size()).append(" rows\n");
        }
        out.append('\n').append("Total records: ").append(table.size());
        return out.toString();
    }

    private static String separator(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width)).append('+');
        }
        return line.append('\n').toString();
    }

    private static void appendRow(StringBuilder out, String[] values, int[] widths) {
        out.append('|');
        for (int i = 0; i < values.length; i++) {
            out.append(String.format("%-" + widths[i] + "s", values[i])).append('|');
        }
        out.append('\n');
    }
}
