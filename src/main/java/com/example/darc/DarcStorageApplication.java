package com.example.darc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DarcStorageApplication {

	public static void main(String[] args) {
		SpringApplication.run(DarcStorageApplication.class, args);
	}

}
