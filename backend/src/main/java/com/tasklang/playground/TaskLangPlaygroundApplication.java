package com.tasklang.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskLangPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskLangPlaygroundApplication.class, args);
    }
}
