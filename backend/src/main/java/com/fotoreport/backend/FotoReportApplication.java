package com.fotoreport.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FotoReportApplication {

	public static void main(String[] args) {
		// Timestamps are stored as timestamptz; keep the JVM on UTC so logs match the database
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(FotoReportApplication.class, args);
	}

}
