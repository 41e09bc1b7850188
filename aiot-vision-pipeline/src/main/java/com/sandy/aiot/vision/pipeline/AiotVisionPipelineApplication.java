package com.sandy.aiot.vision.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotVisionPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotVisionPipelineApplication.class, args);
	}

}
