package com.tony.esportsAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EsportsAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(EsportsAnalyticsApplication.class, args);
	}

}
