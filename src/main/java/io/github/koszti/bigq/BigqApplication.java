package io.github.koszti.bigq;

import io.github.koszti.bigq.config.BigqProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BigqProperties.class)
public class BigqApplication {

	public static void main(String[] args) {
		SpringApplication.run(BigqApplication.class, args);
	}

}
