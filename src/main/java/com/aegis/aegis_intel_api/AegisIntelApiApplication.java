package com.aegis.aegis_intel_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AegisIntelApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(AegisIntelApiApplication.class, args);
	}

}
