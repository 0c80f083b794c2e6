package com.productgap.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.productgap.engine.config")
public class OpportunityEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(OpportunityEngineApplication.class, args);
	}
}
