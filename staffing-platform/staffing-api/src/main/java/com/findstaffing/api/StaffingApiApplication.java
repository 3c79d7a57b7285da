package com.findstaffing.api;

import com.findstaffing.api.config.StaffingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Agency administration back office API.
 */
@SpringBootApplication(scanBasePackages = "com.findstaffing")
@EntityScan(basePackages = "com.findstaffing.core.domain")
@EnableJpaRepositories(basePackages = "com.findstaffing.core.repository")
@EnableConfigurationProperties(StaffingProperties.class)
public class StaffingApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(StaffingApiApplication.class, args);
    }
}
