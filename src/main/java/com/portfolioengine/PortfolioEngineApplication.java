package com.portfolioengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PortfolioEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioEngineApplication.class, args);
    }
}
