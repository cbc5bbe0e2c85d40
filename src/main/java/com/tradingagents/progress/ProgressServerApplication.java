package com.tradingagents.progress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProgressServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProgressServerApplication.class, args);
    }
}
