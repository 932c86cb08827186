package com.openbudget.aggregates;

import com.openbudget.aggregates.config.AggregatesProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AggregatesProperties.class)
public class AggregatesServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AggregatesServiceApplication.class, args);
    }
}
