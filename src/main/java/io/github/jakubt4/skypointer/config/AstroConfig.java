package io.github.jakubt4.skypointer.config;

import io.github.jakubt4.skypointer.astro.EclipticTransform;
import io.github.jakubt4.skypointer.astro.KeplerSolver;
import io.github.jakubt4.skypointer.astro.OrbitalElementProvider;
import io.github.jakubt4.skypointer.astro.PositionCalculator;
import io.github.jakubt4.skypointer.astro.time.TimeModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free astronomy pipeline into the application context.
 */
@Slf4j
@Configuration
public class AstroConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * @throws IllegalArgumentException if the configured cap or tolerance is not positive
     */
    @Bean
    KeplerSolver keplerSolver(@Value("${skypointer.kepler.max-iterations:50}") final int maxIterations,
                              @Value("${skypointer.kepler.tolerance:1e-4}") final double tolerance) {
        final var solver = new KeplerSolver(maxIterations, tolerance);
        log.info("Kepler solver initialized, max {} iterations, tolerance {} rad", maxIterations, tolerance);
        return solver;
    }

    @Bean
    OrbitalElementProvider orbitalElementProvider() {
        return new OrbitalElementProvider();
    }

    @Bean
    EclipticTransform eclipticTransform(final KeplerSolver keplerSolver) {
        return new EclipticTransform(keplerSolver);
    }

    @Bean
    TimeModel timeModel(final Clock clock) {
        return new TimeModel(clock);
    }

    @Bean
    PositionCalculator positionCalculator(final TimeModel timeModel,
                                          final OrbitalElementProvider orbitalElementProvider,
                                          final EclipticTransform eclipticTransform) {
        return new PositionCalculator(timeModel, orbitalElementProvider, eclipticTransform);
    }
}
