package com.example.objectcompressor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ObjectCompressorApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(ObjectCompressorApplication.class, args)));
	}

}
