package com.di.buildtrace;

import com.di.buildtrace.config.BuildTraceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BuildTraceProperties.class)
public class BuildTraceApplication {

	public static void main(String[] args) {
		SpringApplication.run(BuildTraceApplication.class, args);
	}
}
