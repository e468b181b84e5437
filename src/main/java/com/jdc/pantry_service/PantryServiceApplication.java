package com.jdc.pantry_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PantryServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(PantryServiceApplication.class, args);
	}

}
