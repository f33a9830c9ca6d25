package com.tasklang.playground.controller;

import com.tasklang.playground.dto.SyntaxAnalysisRequest;
import com.tasklang.playground.dto.SyntaxAnalysisResponse;
import com.tasklang.playground.service.TaskLangSyntaxAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

/**
 * Token listing for the script editor. A lexer error in the script is a normal
 * response carrying the error position; only failures of the service itself map to 500.
 */
@RestController
@RequestMapping("/api/syntax")
@Validated
public class SyntaxAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisController.class);

    private final TaskLangSyntaxAnalysisService syntaxAnalysisService;

    public SyntaxAnalysisController(TaskLangSyntaxAnalysisService syntaxAnalysisService) {
        this.syntaxAnalysisService = syntaxAnalysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<SyntaxAnalysisResponse> analyzeSyntax(@Valid @RequestBody SyntaxAnalysisRequest request) {
        logger.debug("Received token listing request for {} characters", request.sourceCode().length());

        try {
            SyntaxAnalysisResponse response = syntaxAnalysisService.analyzeSyntax(request);

            if (response.success()) {
                logger.debug("Listed {} tokens", response.tokens().size());
            } else {
                logger.debug("Token listing stopped at line {}, column {}: {}",
                    response.errorLine(), response.errorColumn(), response.error());
            }

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error while listing tokens", e);
            return ResponseEntity.internalServerError()
                .body(SyntaxAnalysisResponse.internalError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Syntax analysis service is running");
    }
}
