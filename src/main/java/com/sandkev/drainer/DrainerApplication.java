package com.sandkev.drainer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DrainerApplication {

	public static void main(String[] args) {
		SpringApplication.run(DrainerApplication.class, args);
	}

}
