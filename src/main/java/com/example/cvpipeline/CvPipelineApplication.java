package com.example.cvpipeline;

import com.example.cvpipeline.config.CvPipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CvPipelineProperties.class)
public class CvPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(CvPipelineApplication.class, args);
	}

}
