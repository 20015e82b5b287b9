package com.biglittle.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BigLittleXApplication {

	public static void main(String[] args) {
		SpringApplication.run(BigLittleXApplication.class, args);
	}

}
