package com.simario;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SimarioApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimarioApplication.class, args);
    }
}
