package com.bmsedge.forecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastingApplication.class, args);
    }
}
