/*
 * Where: heuleum entry point
 * What: Boots Spring with configuration properties scanning and scheduling
 * Why: Retention runs on a schedule and every settings record is bound at startup
 */
package com.example.heuleum;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class HeuleumApplication {

	public static void main(String[] args) {
		SpringApplication.run(HeuleumApplication.class, args);
	}
}
