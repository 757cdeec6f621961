package com.copyleft.GiftsUnderSiege;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class GiftsUnderSiegeApplication {

	public static void main(String[] args) {
		SpringApplication.run(GiftsUnderSiegeApplication.class, args);
	}

}
