package com.university.coursescheduler.config;

import com.university.coursescheduler.solver.MipBackend;
import com.university.coursescheduler.solver.OrToolsMipBackend;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfiguration {

    @Bean
    public MipBackend mipBackend(SchedulerProperties properties) {
        return new OrToolsMipBackend(properties.getSolver().getBackend());
    }
}
