package com.temperamentplatform.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.temperamentplatform.scheduler.strategy.EvaluationTempoStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class SchedulerConfig {

    @Value("${services.flag-service.base-url}")
    private String flagServiceUrl;

    @Value("${scheduler.flag-evaluation.period:P7D}")
    private Duration period;

    @Value("${scheduler.flag-evaluation.retry-interval:PT1H}")
    private Duration retryInterval;

    @Bean
    public WebClient flagServiceClient(WebClient.Builder builder) {
        return builder.baseUrl(flagServiceUrl).build();
    }

    @Bean
    public EvaluationTempoStrategy evaluationTempoStrategy() {
        return new EvaluationTempoStrategy(period, retryInterval);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
