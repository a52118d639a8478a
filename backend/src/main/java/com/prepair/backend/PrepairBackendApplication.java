package com.prepair.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrepairBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(PrepairBackendApplication.class, args);
	}
}
