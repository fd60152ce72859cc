package com.example.donations.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    /**
     * ObjectMapper usado para a tabela, o registro de arquivos processados e as linhas rejeitadas.
     * Exposto como método estático para que os testes usem exatamente a mesma configuração.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.LOWER_CAMEL_CASE);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "donations.poller", name = "enabled", havingValue = "true")
    static class SchedulingConfig {
    }
}
