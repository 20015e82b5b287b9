package com.biglittle.x.builder;

import com.biglittle.x.dto.enums.ProblemVariant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class FormulationStrategyContext {
    private final List<FormulationStrategy> strategies;

    public FormulationStrategy resolve(ProblemVariant variant) {
        return strategies.stream()
                .filter(strategy -> strategy.supports(variant))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported problem variant: " + variant));
    }
}
