package com.nosota.tripfund;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TripFundApplication {
    public static void main(String[] args) {
        SpringApplication.run(TripFundApplication.class, args);
    }
}
