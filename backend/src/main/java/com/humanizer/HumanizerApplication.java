package com.humanizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Humanizer - style-configurable prose rewriting service.
 */
@SpringBootApplication
public class HumanizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(HumanizerApplication.class, args);
	}

}
