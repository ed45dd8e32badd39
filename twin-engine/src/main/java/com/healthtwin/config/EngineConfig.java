package com.healthtwin.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;

/**
 * Engine configuration.
 * The clock zone is configurable via twin.clock.zone; setting twin.baseline.seed makes
 * baseline generation reproducible.
 */
@Configuration
public class EngineConfig {

    public static final String BASELINE_RANDOM_SOURCE = "baselineRandomSource";

    @Value("${twin.clock.zone:UTC}")
    private String clockZone;

    @Value("${twin.baseline.seed:#{null}}")
    private Long baselineSeed;

    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of(clockZone));
    }

    /**
     * Random source per baseline generation: a fresh seeded generator when a seed is
     * configured, otherwise the calling thread's generator.
     */
    @Bean(BASELINE_RANDOM_SOURCE)
    public Supplier<RandomGenerator> baselineRandomSource() {
        if (baselineSeed == null) {
            return ThreadLocalRandom::current;
        }
        long seed = baselineSeed;
        return () -> new SplittableRandom(seed);
    }
}
