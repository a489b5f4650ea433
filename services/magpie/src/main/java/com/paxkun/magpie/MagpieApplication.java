package com.paxkun.magpie;

import com.paxkun.magpie.config.MagpieProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 🐦 Magpie Application Entry Point
 *
 * The main Spring Boot application class for the Magpie image search and re-hosting service.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MagpieProperties.class)
public class MagpieApplication {
    public static void main(String[] args) {
        SpringApplication.run(MagpieApplication.class, args);
    }
}
