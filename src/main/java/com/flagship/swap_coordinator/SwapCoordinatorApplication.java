package com.flagship.swap_coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwapCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwapCoordinatorApplication.class, args);
    }
}
