package com.dka.MissionServer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class MissionServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(MissionServerApplication.class, args);
	}

}
