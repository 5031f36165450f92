package com.venueops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VenueOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(VenueOpsApplication.class, args);
    }
}
