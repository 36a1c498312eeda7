package com.example.zeitpal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ZeitpalApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZeitpalApplication.class, args);
    }
}
