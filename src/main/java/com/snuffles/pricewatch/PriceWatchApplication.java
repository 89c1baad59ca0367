package com.snuffles.pricewatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceWatchApplication.class, args);
    }
}
