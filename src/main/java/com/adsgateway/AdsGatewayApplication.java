package com.adsgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdsGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdsGatewayApplication.class, args);
    }
}
