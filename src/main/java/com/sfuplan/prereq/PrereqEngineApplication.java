package com.sfuplan.prereq;

import com.sfuplan.prereq.config.SuggestionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SuggestionProperties.class)
public class PrereqEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrereqEngineApplication.class, args);
    }
}
