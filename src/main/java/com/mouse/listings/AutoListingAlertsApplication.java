package com.mouse.listings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AutoListingAlertsApplication {

	public static void main(String[] args) {
		SpringApplication.run(AutoListingAlertsApplication.class, args);
	}

}
