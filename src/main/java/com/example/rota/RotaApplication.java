package com.example.rota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(RotaApplication.class, args);
    }
}
