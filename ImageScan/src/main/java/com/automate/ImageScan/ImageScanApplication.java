package com.automate.ImageScan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ImageScanApplication {
	public static void main(String[] args) {
		SpringApplication.run(ImageScanApplication.class, args);
	}

}
