package com.detective.locationtrust.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.detective.locationtrust.repository.GameSessionRepository;
import com.detective.locationtrust.repository.impl.InMemoryGameSessionRepository;

/** Infrastructure beans shared by the validation services. */
@Configuration
public class LocationTrustConfiguration {

    /** Wall clock used for fix freshness checks; tests replace it with a fixed clock. */
    @Bean
    @ConditionalOnMissingBean
    public Clock locationTrustClock() {
        return Clock.systemUTC();
    }

    /** Single-process session store, replaced by the game's datastore adapter when one is present. */
    @Bean
    @ConditionalOnMissingBean(GameSessionRepository.class)
    public InMemoryGameSessionRepository inMemoryGameSessionRepository() {
        return new InMemoryGameSessionRepository();
    }
}
