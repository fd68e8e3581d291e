package com.temperamentplatform.scheduler.job;

import com.temperamentplatform.common.trace.TraceContextUtil;
import com.temperamentplatform.scheduler.client.FlagServiceClient;
import com.temperamentplatform.scheduler.strategy.EvaluationTempoStrategy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodic population flag evaluation.
 *
 * <pre>
 *   delay(interval) → POST /evaluate/population → pick next interval → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe} schedules the next
 * one; {@code Mono.delay} holds no thread while waiting. The loop never stops: a failed
 * call reschedules with {@link EvaluationTempoStrategy#afterFailure()}.
 */
@Component
public class FlagEvaluationScheduler {

    private static final Logger log = LoggerFactory.getLogger(FlagEvaluationScheduler.class);

    private final FlagServiceClient flagServiceClient;
    private final EvaluationTempoStrategy tempo;

    @Value("${scheduler.flag-evaluation.enabled:true}")
    private boolean enabled;

    @Value("${scheduler.flag-evaluation.initial-delay:PT1M}")
    private Duration initialDelay;

    public FlagEvaluationScheduler(FlagServiceClient flagServiceClient, EvaluationTempoStrategy tempo) {
        this.flagServiceClient = flagServiceClient;
        this.tempo             = tempo;
    }

    @PostConstruct
    public void startScheduling() {
        if (!enabled) {
            log.info("Flag evaluation scheduling disabled");
            return;
        }
        log.info("Flag evaluation scheduler started. initialDelaySeconds={} periodSeconds={}",
                 initialDelay.toSeconds(), tempo.period().toSeconds());
        scheduleNextCycle(initialDelay);
    }

    private void scheduleNextCycle(Duration delay) {
        Mono.delay(delay)
            .then(Mono.defer(this::runOnce))
            .subscribe(
                next -> {
                    log.info("Next flag evaluation scheduled. nextIntervalSeconds={}", next.toSeconds());
                    scheduleNextCycle(next);
                },
                err -> {
                    log.error("Flag evaluation cycle failed, rescheduling with retry interval. retrySeconds={}",
                              tempo.afterFailure().toSeconds(), err);
                    scheduleNextCycle(tempo.afterFailure());
                }
            );
    }

    /** Runs one population evaluation and returns the delay before the next one. */
    Mono<Duration> runOnce() {
        String traceId = TraceContextUtil.newTraceId();
        log.info("Triggering population evaluation. traceId={}", traceId);
        return flagServiceClient.evaluatePopulation(traceId)
            .map(tempo::resolve)
            .defaultIfEmpty(tempo.afterFailure());
    }
}
