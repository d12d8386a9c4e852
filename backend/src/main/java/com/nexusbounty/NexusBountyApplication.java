package com.nexusbounty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NexusBountyApplication {

    public static void main(String[] args) {
        SpringApplication.run(NexusBountyApplication.class, args);
    }
}
