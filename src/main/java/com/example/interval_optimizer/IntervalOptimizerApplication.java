package com.example.interval_optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntervalOptimizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(IntervalOptimizerApplication.class, args);
	}

}
