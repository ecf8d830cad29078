package com.retail.herd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HerdTrendDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HerdTrendDetectorApplication.class, args);
    }
}
