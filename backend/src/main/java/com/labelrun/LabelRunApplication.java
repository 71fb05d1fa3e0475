package com.labelrun;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabelRunApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabelRunApplication.class, args);
    }
}
