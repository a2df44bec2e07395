package com.transport.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransportXApplication {

	public static void main(String[] args) {
		SpringApplication.run(TransportXApplication.class, args);
	}

}
