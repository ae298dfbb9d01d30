package com.bmsedge.sellout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SelloutIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SelloutIngestionApplication.class, args);
    }
}
