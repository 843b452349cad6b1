package com.docclassifier.processing.strategy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class StrategyConfig {

    /**
     * Registers strategies in their {@code @Order}: financial, healthcare, identity.
     */
    @Bean
    public StrategyRegistry strategyRegistry(List<IndustryStrategy> strategies) {
        StrategyRegistry registry = new StrategyRegistry();
        strategies.forEach(registry::register);
        registry.seal();
        return registry;
    }
}
