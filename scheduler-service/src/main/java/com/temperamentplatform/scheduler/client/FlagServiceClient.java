package com.temperamentplatform.scheduler.client;

import com.temperamentplatform.common.model.PopulationEvaluationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Triggers population evaluation runs on flag-service.
 *
 * <p>Errors are logged and propagated so the scheduler can pick its retry interval.
 */
@Component
public class FlagServiceClient {

    private static final Logger log = LoggerFactory.getLogger(FlagServiceClient.class);

    private final WebClient flagServiceClient;

    public FlagServiceClient(WebClient flagServiceClient) {
        this.flagServiceClient = flagServiceClient;
    }

    public Mono<PopulationEvaluationSummary> evaluatePopulation(String traceId) {
        return flagServiceClient.post()
            .uri("/api/v1/flags/evaluate/population")
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(PopulationEvaluationSummary.class)
            .doOnNext(s -> log.info("Population evaluation completed. traceId={} runTraceId={} evaluated={} assigned={} skipped={} errors={}",
                                       traceId, s.traceId(), s.evaluated(), s.assigned(), s.skipped(), s.errors().size()))
            .doOnError(e -> log.warn("Population evaluation call failed. traceId={} reason={}",
                                     traceId, e.getMessage()));
    }
}
