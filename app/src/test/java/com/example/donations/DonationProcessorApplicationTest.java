package com.example.donations;

import com.example.donations.poller.IncomingDonationsPoller;
import com.example.donations.repository.LifetimeGivingRepository;
import com.example.donations.runner.DonationProcessingRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DonationProcessorApplicationTest {

    @TempDir
    static Path tempDir;

    @DynamicPropertySource
    static void donationDirectories(DynamicPropertyRegistry registry) throws IOException {
        Path incoming = Files.createDirectories(tempDir.resolve("Incoming"));
        Files.writeString(incoming.resolve("donations.csv"),
                "DonorID,Name,Amount,Date\n1,Joe Smith,5,1/2/2026\n2,Jane Smith,10,1/3/2026\n");
        registry.add("donations.intake.directory", incoming::toString);
        registry.add("donations.intake.archive-directory", () -> incoming.resolve("processed").toString());
        registry.add("donations.intake.rejected-directory", () -> incoming.resolve("rejected").toString());
        registry.add("donations.intake.duplicates-directory", () -> incoming.resolve("duplicates").toString());
        registry.add("donations.table.warehouse-directory", () -> tempDir.resolve("warehouse").toString());
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private LifetimeGivingRepository lifetimeGivingRepository;

    @Test
    void startup_shouldProcessIncomingFilesOnce() throws IOException {
        assertThat(context.getBeansOfType(DonationProcessingRunner.class)).hasSize(1);
        assertThat(context.getBeansOfType(IncomingDonationsPoller.class)).isEmpty();

        assertThat(lifetimeGivingRepository.findAll()).hasValueSatisfying(table ->
                assertThat(table).extracting(entry -> entry.getDonorId()).containsExactly(1L, 2L));
        assertThat(tempDir.resolve("Incoming").resolve("processed").resolve("donations.csv")).exists();
    }
}
