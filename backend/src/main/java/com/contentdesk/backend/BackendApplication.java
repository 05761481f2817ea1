package com.contentdesk.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContentDesk API entry point. Component scanning starts here, so this class stays in the root
 * package above {@code global} and {@code modules}.
 */
@SpringBootApplication
public class BackendApplication {

	private static final String SERVER_TIME_ZONE = "UTC";

	public static void main(String[] args) {
		// token expiry, soft delete stamps and audit rows are all compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone(SERVER_TIME_ZONE));
		SpringApplication.run(BackendApplication.class, args);
	}
}
