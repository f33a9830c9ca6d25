package com.tasklang.playground.controller;

import com.tasklang.playground.dto.SyntaxAnalysisRequest;
import com.tasklang.playground.service.TaskLangSyntaxAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyntaxAnalysisController.class)
class SyntaxAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaskLangSyntaxAnalysisService syntaxAnalysisService;

    @Test
    void serviceFailureIsAnInternalErrorWithoutPosition() throws Exception {
        when(syntaxAnalysisService.analyzeSyntax(any(SyntaxAnalysisRequest.class)))
                .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/syntax/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"open chrome\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorStage").value("internal"))
                .andExpect(jsonPath("$.error").value("Internal server error: boom"))
                .andExpect(jsonPath("$.errorLine").doesNotExist())
                .andExpect(jsonPath("$.errorColumn").doesNotExist())
                .andExpect(jsonPath("$.tokens").isEmpty());
    }
}
