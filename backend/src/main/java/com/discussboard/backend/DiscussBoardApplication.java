package com.discussboard.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiscussBoardApplication {

	public static void main(String[] args) {
		// all persisted timestamps and logs are UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(DiscussBoardApplication.class, args);
	}

}
