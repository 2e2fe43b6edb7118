package com.gradientcast.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GradientCastApplication {

    public static void main(String[] args) {
        SpringApplication.run(GradientCastApplication.class, args);
    }
}
