package com.claimvoyant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class ClaimvoyantApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClaimvoyantApplication.class, args);
    }
}
