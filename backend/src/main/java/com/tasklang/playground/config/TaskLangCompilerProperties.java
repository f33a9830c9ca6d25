package com.tasklang.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "tasklang.compiler")
@Validated
public record TaskLangCompilerProperties(
    @NotBlank
    @DefaultValue("output")
    String outputDirectory,

    @Positive
    @DefaultValue("10000")
    Integer maxSourceCodeLength
) {

    public static TaskLangCompilerProperties defaults() {
        return new TaskLangCompilerProperties("output", 10000);
    }
}
