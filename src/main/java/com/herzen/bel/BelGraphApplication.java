package com.herzen.bel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BelGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(BelGraphApplication.class, args);
    }
}
