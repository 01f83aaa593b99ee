package com.nei10u.taxmusr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxMusrApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxMusrApplication.class, args);
    }
}
