package com.poc.xlstaging;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XlStagingApplication {

    public static void main(String[] args) {
        SpringApplication.run(XlStagingApplication.class, args);
    }
}
