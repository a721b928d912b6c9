package com.aastreli.modelengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ModelEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelEngineApplication.class, args);
    }
}
