package com.tasklang.playground.service;

import com.tasklang.playground.codegen.PythonCodeGenerator;
import com.tasklang.playground.config.TaskLangCompilerProperties;
import com.tasklang.playground.dto.CompileRequest;
import com.tasklang.playground.dto.CompileResponse;
import com.tasklang.playground.exception.LexerException;
import com.tasklang.playground.exception.ParserException;
import com.tasklang.playground.exception.SemanticException;
import com.tasklang.playground.lexer.Lexer;
import com.tasklang.playground.lexer.Token;
import com.tasklang.playground.parser.Parser;
import com.tasklang.playground.parser.ast.AstPrinter;
import com.tasklang.playground.parser.ast.Program;
import com.tasklang.playground.semantic.SemanticAnalyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Runs the lexer, parser, semantic analyzer and code generator over a script and
 * reports the outcome of the first failing stage, if any.
 */
@Service
public class TaskLangCompilerService {

    private static final Logger logger = LoggerFactory.getLogger(TaskLangCompilerService.class);

    private final TaskLangCompilerProperties properties;
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();
    private final PythonCodeGenerator generator = new PythonCodeGenerator();
    private final AstPrinter astPrinter = new AstPrinter();

    public TaskLangCompilerService(TaskLangCompilerProperties properties) {
        this.properties = properties;
    }

    public CompileResponse compile(CompileRequest request) {
        String sourceCode = request.sanitizedSourceCode();

        if (sourceCode.isBlank()) {
            return CompileResponse.compilationError("Source code cannot be empty");
        }

        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return CompileResponse.compilationError(
                "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters"
            );
        }

        long startTime = System.currentTimeMillis();

        try {
            List<Token> tokens = new Lexer(sourceCode).tokenize();
            logger.debug("Lexer produced {} tokens", tokens.size());

            Program program = new Parser(tokens).parse();
            logger.debug("Parser produced {} statements", program.size());

            analyzer.analyze(program);

            String generatedCode = generator.generate(program);

            String outputPath = null;
            if (request.scriptName() != null) {
                try {
                    outputPath = writeScript(request.scriptName(), generatedCode).toString();
                    logger.info("Wrote generated script to {}", outputPath);
                } catch (IOException e) {
                    logger.error("Failed to write script '{}': {}", request.scriptName(), e.getMessage(), e);
                    return CompileResponse.outputError(
                        generatedCode,
                        "Failed to write generated script: " + e.getMessage(),
                        elapsedSince(startTime));
                }
            }

            long compilationTime = elapsedSince(startTime);
            logger.info("Compiled {} statements in {}ms", program.size(), compilationTime);

            return CompileResponse.success(
                generatedCode,
                astPrinter.print(program),
                tokens.size(),
                program.size(),
                outputPath,
                compilationTime);

        } catch (LexerException e) {
            logger.warn("Lexer error: {}", e.getMessage());
            return CompileResponse.sourceError(
                e.getStage(), e.getMessage(), e.getLine(), e.getColumn(), elapsedSince(startTime));
        } catch (ParserException e) {
            logger.warn("Parser error: {}", e.getMessage());
            return CompileResponse.sourceError(
                e.getStage(), e.getMessage(), e.getLine(), e.getColumn(), elapsedSince(startTime));
        } catch (SemanticException e) {
            logger.warn("Semantic error: {}", e.getMessage());
            return CompileResponse.semanticError(e.getMessage(), e.getStatementIndex(), elapsedSince(startTime));
        }
    }

    private Path writeScript(String scriptName, String generatedCode) throws IOException {
        Path outputDir = Path.of(properties.outputDirectory());
        Files.createDirectories(outputDir);

        Path scriptFile = outputDir.resolve(scriptName + ".py");
        Files.writeString(scriptFile, generatedCode,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return scriptFile;
    }

    private long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
