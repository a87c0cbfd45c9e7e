package com.mouse.cricket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CricketScraperApplication {

	public static void main(String[] args) {
		SpringApplication.run(CricketScraperApplication.class, args);
	}

}
