package com.deepansh.research;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class InvestmentResearchApplication {
    public static void main(String[] args) {
        SpringApplication.run(InvestmentResearchApplication.class, args);
    }
}
