package com.example.donations.merge;

import com.example.donations.config.DonationProperties;
import com.example.donations.model.DonationRecord;
import com.example.donations.model.LifetimeGivingEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Agrega um lote de doações por doador e mescla o resultado com a tabela existente.
 * Não faz IO: recebe a tabela anterior e devolve a tabela substituta completa.
 */
@Component
public class LifetimeGivingMerger {

    private static final Logger log = LoggerFactory.getLogger(LifetimeGivingMerger.class);

    private final boolean parallel;

    public LifetimeGivingMerger(DonationProperties properties) {
        this.parallel = properties.getMerge().isParallel();
    }

    /**
     * Agrupa as doações por DonorID: soma dos valores, maior data e o nome da linha com a
     * maior data (em caso de empate, a última linha na ordem de entrada).
     *
     * @param records As doações do lote, na ordem em que foram lidas.
     * @return Um agregado por doador, ordenado por DonorID.
     */
    public Map<Long, DonorAggregate> aggregate(List<DonationRecord> records) {
        IntStream indexes = IntStream.range(0, records.size());
        if (parallel) {
            indexes = indexes.parallel();
        }
        return indexes
                .mapToObj(i -> DonorAggregate.of(records.get(i), i))
                .collect(Collectors.toMap(DonorAggregate::getDonorId, Function.identity(),
                        DonorAggregate::combine, TreeMap::new));
    }

    /**
     * Mescla os agregados do lote com a tabela anterior (união completa dos DonorIDs).
     * <ul>
     *     <li>Doador só na tabela anterior: mantido sem alteração.</li>
     *     <li>Doador só no lote: nova entrada com a soma e a data máxima do lote.</li>
     *     <li>Doador nos dois: valores somados e a maior das duas datas. O nome vem do lado com a
     *     doação mais recente; em caso de empate, prevalece o nome do lote. Um nome em branco
     *     nunca substitui um nome conhecido.</li>
     * </ul>
     *
     * @param priorTable A tabela atual; vazia se ainda não existir.
     * @param batch Os agregados do lote.
     * @return A nova tabela completa, ordenada por DonorID.
     */
    public List<LifetimeGivingEntry> merge(Collection<LifetimeGivingEntry> priorTable, Map<Long, DonorAggregate> batch) {
        Map<Long, LifetimeGivingEntry> merged = priorTable.stream()
                .collect(Collectors.toMap(LifetimeGivingEntry::getDonorId, Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("DonorID duplicado na tabela anterior: " + a.getDonorId());
                        },
                        TreeMap::new));

        int created = 0;
        int updated = 0;
        for (DonorAggregate aggregate : batch.values()) {
            LifetimeGivingEntry prior = merged.get(aggregate.getDonorId());
            if (prior == null) {
                merged.put(aggregate.getDonorId(), LifetimeGivingEntry.builder()
                        .donorId(aggregate.getDonorId())
                        .name(aggregate.getBatchName())
                        .lifetimeAmount(aggregate.getBatchSum())
                        .lastDonation(aggregate.getBatchMaxDate())
                        .build());
                created++;
            } else {
                boolean batchIsCurrent = !aggregate.getBatchMaxDate().isBefore(prior.getLastDonation());
                merged.put(aggregate.getDonorId(), prior.toBuilder()
                        .name(batchIsCurrent
                                ? firstNonNull(aggregate.getBatchName(), prior.getName())
                                : firstNonNull(prior.getName(), aggregate.getBatchName()))
                        .lifetimeAmount(prior.getLifetimeAmount().add(aggregate.getBatchSum()))
                        .lastDonation(batchIsCurrent ? aggregate.getBatchMaxDate() : prior.getLastDonation())
                        .build());
                updated++;
            }
        }

        log.info("Mesclagem concluída. Doadores novos: {}, atualizados: {}, inalterados: {}",
                created, updated, merged.size() - created - updated);
        return new ArrayList<>(merged.values());
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }

    public List<LifetimeGivingEntry> mergeBatch(Collection<LifetimeGivingEntry> priorTable, List<DonationRecord> records) {
        return merge(priorTable, aggregate(records));
    }
}
