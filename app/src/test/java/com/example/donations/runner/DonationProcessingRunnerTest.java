package com.example.donations.runner;

import com.example.donations.config.DonationProperties;
import com.example.donations.exception.DonationProcessingException;
import com.example.donations.exception.ProcessingStage;
import com.example.donations.model.ProcessingReport;
import com.example.donations.report.LifetimeGivingTableFormatter;
import com.example.donations.service.DonationBatchService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DonationProcessingRunnerTest {

    private final DonationBatchService service = mock(DonationBatchService.class);
    private final DonationProcessingRunner runner =
            new DonationProcessingRunner(service, new LifetimeGivingTableFormatter(new DonationProperties()));

    @Test
    void run_shouldProcessOnce() {
        when(service.process()).thenReturn(ProcessingReport.builder()
                .table(List.of())
                .tableUpdated(false)
                .build());

        runner.run(new DefaultApplicationArguments());

        verify(service, times(1)).process();
    }

    @Test
    void run_shouldPropagateFailureWithItsStage() {
        when(service.process())
                .thenThrow(new DonationProcessingException(ProcessingStage.READ_PRIOR_TABLE, "tabela corrompida"));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(DonationProcessingException.class)
                .hasMessage("tabela corrompida")
                .extracting(e -> ((DonationProcessingException) e).getStage())
                .isEqualTo(ProcessingStage.READ_PRIOR_TABLE);
    }
}
