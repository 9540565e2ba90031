package com.nemweb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NemwebForecastApplication {

    private static final Logger log = LoggerFactory.getLogger(NemwebForecastApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(NemwebForecastApplication.class, args);
        log.info("NEMWEB Forecast Engine started.");
        log.info("Current price: GET http://localhost:8080/regions/NSW1/current");
        log.info("Forecast:      GET http://localhost:8080/regions/NSW1/forecast/five_minute");
        log.info("Status:        GET http://localhost:8080/status");
        log.info("Health:        GET http://localhost:8080/actuator/health");
    }
}
