package com.aiPortfolio.secureGateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecureGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureGatewayApplication.class, args);
    }
}
