package com.biglittle.x.config;

import com.biglittle.x.processors.backend.ConstraintBackend;
import com.biglittle.x.processors.backend.CpSatBackend;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class SolverConfig {

    @Bean
    public SolverProperties solverProperties(
            @Value("${matching.solver.time-limit-seconds:30}") long timeLimitSeconds,
            @Value("${matching.solver.num-workers:8}") int numWorkers,
            @Value("${matching.solver.log-search-progress:false}") boolean logSearchProgress) {
        if (timeLimitSeconds <= 0 || numWorkers <= 0) {
            throw new IllegalArgumentException("Solver time limit and worker count must be positive, got "
                    + timeLimitSeconds + "s and " + numWorkers + " workers");
        }
        log.info("Solver configured: timeLimitSeconds={}, numWorkers={}, logSearchProgress={}",
                timeLimitSeconds, numWorkers, logSearchProgress);
        return SolverProperties.builder()
                .timeLimit(Duration.ofSeconds(timeLimitSeconds))
                .numWorkers(numWorkers)
                .logSearchProgress(logSearchProgress)
                .build();
    }

    @Bean
    public ConstraintBackend constraintBackend(SolverProperties solverProperties) {
        return new CpSatBackend(solverProperties);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
