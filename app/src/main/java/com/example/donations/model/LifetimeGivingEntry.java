package com.example.donations.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Uma linha da tabela DonorLifetimeGiving: o total acumulado e a data da doação
 * mais recente de um doador.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"DonorID", "Name", "LifetimeAmount", "LastDonation"})
public class LifetimeGivingEntry {

    @JsonProperty("DonorID")
    private Long donorId;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("LifetimeAmount")
    private BigDecimal lifetimeAmount;

    @JsonProperty("LastDonation")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private LocalDate lastDonation;
}
