package com.github.salilvnair.convroute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ConvRouteApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConvRouteApplication.class, args);
    }
}
