package com.ibstrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IbsTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(IbsTraderApplication.class, args);
    }
}
