package com.sonicgalaxy.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SonicGalaxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SonicGalaxyApplication.class, args);
    }
}
