package com.catagent.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.catagent.gateway")
public class CatAgentApp {

    public static void main(String[] args) {
        SpringApplication.run(CatAgentApp.class, args);
    }
}
