package com.example.donations.merge;

import com.example.donations.model.DonationRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Agregado das doações de um doador dentro de um lote: soma, data máxima e o nome da
 * linha mais recente que tem nome. Linhas com Name em branco só fornecem o nome quando
 * nenhuma outra o tem. {@link #combine} é associativo e comutativo, então lotes podem ser
 * particionados livremente.
 */
@Value
public class DonorAggregate {

    private static final Comparator<DonorAggregate> NAME_PRECEDENCE = Comparator
            .comparing((DonorAggregate aggregate) -> aggregate.getBatchName() != null)
            .thenComparing(DonorAggregate::getNameDate)
            .thenComparingLong(DonorAggregate::getNameSequence);

    long donorId;
    BigDecimal batchSum;
    LocalDate batchMaxDate;
    String batchName;
    // data e posição no lote da linha que forneceu o nome
    LocalDate nameDate;
    long nameSequence;

    public static DonorAggregate of(DonationRecord record, long sequence) {
        return new DonorAggregate(record.getDonorId(), record.getAmount(), record.getDate(),
                record.getName(), record.getDate(), sequence);
    }

    public DonorAggregate combine(DonorAggregate other) {
        if (other.donorId != donorId) {
            throw new IllegalArgumentException("Não é possível combinar agregados de doadores diferentes: "
                    + donorId + " e " + other.donorId);
        }
        DonorAggregate nameSource = NAME_PRECEDENCE.compare(this, other) >= 0 ? this : other;
        LocalDate maxDate = batchMaxDate.isAfter(other.batchMaxDate) ? batchMaxDate : other.batchMaxDate;
        return new DonorAggregate(donorId, batchSum.add(other.batchSum), maxDate,
                nameSource.batchName, nameSource.nameDate, nameSource.nameSequence);
    }
}
