package com.example.reelbot_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ReelbotBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReelbotBackendApplication.class, args);
	}

}
