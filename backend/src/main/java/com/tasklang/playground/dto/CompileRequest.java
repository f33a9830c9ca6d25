package com.tasklang.playground.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * The source length limit is {@code tasklang.compiler.max-source-code-length},
 * enforced by the compiler service.
 */
public record CompileRequest(
    @NotBlank(message = "Source code cannot be blank")
    String sourceCode,

    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "Script name may only contain letters, digits, '_' and '-'")
    @Size(max = 100, message = "Script name cannot exceed 100 characters")
    String scriptName
) {

    /**
     * Normalizes line endings only, so diagnostics keep pointing at the submitted text.
     */
    public String sanitizedSourceCode() {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
