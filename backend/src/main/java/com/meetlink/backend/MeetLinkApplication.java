package com.meetlink.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetLinkApplication {

	public static void main(String[] args) {
		// Link expiry and auto-end instants are compared in UTC across instances
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(MeetLinkApplication.class, args);
	}

}
