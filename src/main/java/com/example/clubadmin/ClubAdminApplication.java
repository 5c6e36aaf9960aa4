package com.example.clubadmin;

import com.example.clubadmin.config.ClubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@EnableConfigurationProperties(ClubProperties.class)
public class ClubAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClubAdminApplication.class, args);
    }
}
