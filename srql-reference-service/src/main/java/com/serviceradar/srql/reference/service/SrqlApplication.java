package com.serviceradar.srql.reference.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.serviceradar.srql.controller", "com.serviceradar.srql.service"})
public class SrqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SrqlApplication.class, args);
    }
}
