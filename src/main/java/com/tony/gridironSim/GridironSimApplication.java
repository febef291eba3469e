package com.tony.gridironSim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GridironSimApplication {

	public static void main(String[] args) {
		SpringApplication.run(GridironSimApplication.class, args);
	}

}
