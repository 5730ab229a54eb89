package com.residencecare.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResidenceCareApplication {

	public static void main(String[] args) {
		// ledger timestamps and logs are always UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(ResidenceCareApplication.class, args);
	}

}
