package com.outfitrules;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OutfitRulesApplication {

    public static void main(String[] args) {
        SpringApplication.run(OutfitRulesApplication.class, args);
    }
}
