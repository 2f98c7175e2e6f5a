package com.tvlradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TvlRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(TvlRadarApplication.class, args);
    }
}
