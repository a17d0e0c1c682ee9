package com.prfactory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrFactoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrFactoryApplication.class, args);
    }
}
