package com.tradecodes.classifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TariffClassifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(TariffClassifierApplication.class, args);
    }
}
