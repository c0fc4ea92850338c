package com.herzen.ink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InkEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(InkEngineApplication.class, args);
    }
}
