package com.example.Orin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrinApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrinApplication.class, args);
    }
}
