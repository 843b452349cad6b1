package com.docclassifier.processing.strategy;

import com.docclassifier.shared.exception.UnknownIndustryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Industry strategies keyed by industry name, in registration order. Re-registering an
 * industry replaces the strategy in its original slot.
 */
public class StrategyRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, IndustryStrategy> strategies = new LinkedHashMap<>();
    private volatile List<IndustryStrategy> ordered = List.of();
    private volatile boolean sealed;

    public synchronized void register(IndustryStrategy strategy) {
        if (sealed) {
            throw new IllegalStateException("Strategy registry is sealed; cannot register " + strategy.industryName());
        }
        IndustryStrategy previous = strategies.put(strategy.industryName(), strategy);
        if (previous != null) {
            logger.warn("Strategy for industry '{}' replaced: {} -> {}", strategy.industryName(), previous, strategy);
        } else {
            logger.info("Registered strategy {}", strategy);
        }
        ordered = Collections.unmodifiableList(new ArrayList<>(strategies.values()));
    }

    public synchronized void seal() {
        sealed = true;
    }

    public boolean isRegistered(String industry) {
        return industry != null && ordered.stream().anyMatch(s -> s.industryName().equals(industry));
    }

    /**
     * Candidate strategies for a classification request.
     *
     * @param industry requested industry, or null/blank for every registered strategy
     * @throws UnknownIndustryException if an industry is named but not registered
     */
    public List<IndustryStrategy> strategiesFor(String industry) {
        List<IndustryStrategy> snapshot = ordered;
        if (industry == null || industry.isBlank()) {
            return snapshot;
        }
        for (IndustryStrategy strategy : snapshot) {
            if (strategy.industryName().equals(industry)) {
                return List.of(strategy);
            }
        }
        throw new UnknownIndustryException(industry);
    }

    /**
     * Throws {@link UnknownIndustryException} unless the industry is absent or registered.
     */
    public void validate(String industry) {
        strategiesFor(industry);
    }

    public List<String> industries() {
        List<String> names = new ArrayList<>();
        for (IndustryStrategy strategy : ordered) {
            names.add(strategy.industryName());
        }
        return names;
    }

    public List<Map<String, Object>> metadata() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (IndustryStrategy strategy : ordered) {
            result.add(strategy.metadata());
        }
        return result;
    }
}
