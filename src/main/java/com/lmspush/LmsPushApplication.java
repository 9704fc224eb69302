package com.lmspush;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LmsPushApplication {

    public static void main(String[] args) {
        SpringApplication.run(LmsPushApplication.class, args);
    }
}
