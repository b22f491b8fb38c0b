package com.example.interviewcoach;

import com.example.interviewcoach.config.CoachProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CoachProperties.class)
public class InterviewCoachApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(InterviewCoachApplication.class, args)));
	}

}
