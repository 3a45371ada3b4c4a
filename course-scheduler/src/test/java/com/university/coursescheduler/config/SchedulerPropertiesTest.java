package com.university.coursescheduler.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void bindsDefaultsAndOverrides() {
        contextRunner
                .withPropertyValues("scheduler.seed=42", "scheduler.solver.consensus-time-limit=5s")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SchedulerProperties properties = context.getBean(SchedulerProperties.class);
                    assertThat(properties.getSeed()).isEqualTo(42L);
                    assertThat(properties.getSolver().getConsensusTimeLimit()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getSolver().getBackend()).isEqualTo("SCIP");
                    assertThat(properties.getSatisfaction().getMaxRank()).isEqualTo(4);
                });
    }

    @Test
    void rejectsInvertedNoiseRange() {
        contextRunner
                .withPropertyValues("scheduler.satisfaction.noise-min=0.8", "scheduler.satisfaction.noise-max=0.2")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("noise-min must not exceed noise-max"));
    }

    @Test
    void rejectsMaxRankBelowOne() {
        contextRunner
                .withPropertyValues("scheduler.satisfaction.max-rank=0")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasStackTraceContaining("maxRank"));
    }

    @Test
    void rejectsNegativeNoise() {
        contextRunner
                .withPropertyValues("scheduler.satisfaction.noise-min=-0.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(SchedulerProperties.class)
    static class PropertiesConfig {
    }
}
