package com.tony.nflStats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NflStatsApplication {

	public static void main(String[] args) {
		SpringApplication.run(NflStatsApplication.class, args);
	}

}
