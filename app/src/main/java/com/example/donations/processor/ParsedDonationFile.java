package com.example.donations.processor;

import com.example.donations.model.DonationRecord;
import com.example.donations.model.RejectedRecord;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

@Data
@Builder
public class ParsedDonationFile {
    private String fileName;
    @Singular
    private List<DonationRecord> records;
    @Singular
    private List<RejectedRecord> rejections;
}
