package com.marketloop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class MarketLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketLoopApplication.class, args);
    }
}
