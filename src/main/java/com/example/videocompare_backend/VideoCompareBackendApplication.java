package com.example.videocompare_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoCompareBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(VideoCompareBackendApplication.class, args);
	}

}
