package com.bizlaw;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BizLawAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BizLawAdvisorApplication.class, args);
    }
}
