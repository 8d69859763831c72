package com.urbanparking.availability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

import java.util.Collections;

@SpringBootApplication
@EnableCaching
public class ParkingAvailabilityApplication {
	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(ParkingAvailabilityApplication.class);

		// Set default profile if not specified
		String profilesActive = System.getenv("SPRING_PROFILES_ACTIVE");
		if (profilesActive == null || profilesActive.isEmpty()) {
			app.setDefaultProperties(Collections.singletonMap("spring.profiles.active", "dev"));
		}

		app.run(args);
	}
}
