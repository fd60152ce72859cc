package com.example.donations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DonationProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DonationProcessorApplication.class, args);
    }
}
