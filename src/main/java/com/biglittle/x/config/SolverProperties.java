package com.biglittle.x.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Builder
@Getter
public class SolverProperties {
    private final Duration timeLimit;
    private final int numWorkers;
    private final boolean logSearchProgress;
}
