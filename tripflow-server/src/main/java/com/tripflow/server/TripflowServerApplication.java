package com.tripflow.server;

import com.tripflow.common.properties.AiProperties;
import com.tripflow.common.properties.PlannerProperties;
import com.tripflow.common.properties.ProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({AiProperties.class, PlannerProperties.class, ProviderProperties.class})
@EnableScheduling
public class TripflowServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripflowServerApplication.class, args);
    }
}
