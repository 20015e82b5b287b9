package com.biglittle.x.matcher.strategies;

import com.biglittle.x.dto.enums.SolverPath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class MatchingStrategyContext {
    private final List<MatchingStrategy> strategies;

    public MatchingStrategy resolve(SolverPath path) {
        return strategies.stream()
                .filter(strategy -> strategy.supports(path))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported solver path: " + path));
    }
}
