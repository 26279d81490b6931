package com.example.SmartNews;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.io.File;

@SpringBootApplication
@EnableScheduling
public class SmartNewsApplication {
	private static final Logger logger = LoggerFactory.getLogger(SmartNewsApplication.class);

	public static void main(String[] args) {
		logEnvironmentInfo();
		if (System.getenv("SMARTNEWS_MANAGED") == null) {
			loadDotEnvFile();
		}
		SpringApplication.run(SmartNewsApplication.class, args);
	}

	private static void logEnvironmentInfo() {
		logger.info("=== Application Startup Information ===");
		logger.info("Startup time: {}", new java.util.Date());
		logger.info("DATABASE_URL: {}", maskUrl(System.getenv("DATABASE_URL")));
		logger.info("DATABASE_USERNAME: {}", System.getenv("DATABASE_USERNAME"));
		logger.info("DATABASE_PASSWORD: {}", System.getenv("DATABASE_PASSWORD") != null ? "***CONFIGURED***" : "NOT SET");
		logger.info("API_KEY: {}", System.getenv("API_KEY") != null ? "***CONFIGURED***" : "NOT SET");
		logger.info("SPRING_PROFILES_ACTIVE: {}", System.getenv("SPRING_PROFILES_ACTIVE"));
		logger.info("========================================");
	}

	private static void loadDotEnvFile() {
		try {
			File envFile = new File(".env");
			logger.info("Checking .env file at {}: exists={}, readable={}",
					envFile.getAbsolutePath(), envFile.exists(), envFile.canRead());
			Dotenv dotenv = Dotenv.configure()
					.ignoreIfMissing()
					.load();
			dotenv.entries().forEach(entry -> System.setProperty(entry.getKey(), entry.getValue()));
			logger.info("Loaded .env file with {} entries", dotenv.entries().size());
		} catch (Exception e) {
			logger.error("Failed to load .env file: {}", e.getMessage(), e);
		}
	}

	private static String maskUrl(String url) {
		if (url == null) return "NOT SET";
		return url.replaceAll(":[^@]+@", ":***@");
	}
}
