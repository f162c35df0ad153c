package me.christianrobert.ast2c.generator.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.ast2c.config.service.ConfigService;
import me.christianrobert.ast2c.generator.builder.CCodeBuilder;
import me.christianrobert.ast2c.generator.context.GenerationContext;
import me.christianrobert.ast2c.generator.context.GenerationException;
import me.christianrobert.ast2c.generator.context.GenerationResult;
import me.christianrobert.ast2c.generator.util.AstTreeFormatter;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.parser.AstJsonReader;
import me.christianrobert.ast2c.tree.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * High-level service for turning JSON syntax-tree dumps back into C source.
 * This is the entry point used by the REST endpoint and the command line.
 *
 * <p>Architecture:
 * <pre>
 * JSON tree → AstJsonReader → AstValue tree → CCodeBuilder → C source
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * GenerationResult result = service.generate(json, false);
 * if (result.isSuccess()) {
 *     String code = result.getCode();
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 *
 * <p>Malformed input never reaches the generator: a tree that cannot be read produces a
 * failed result and no partial output.</p>
 */
@ApplicationScoped
public class CodeGenerationService {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationService.class);

    @Inject
    AstJsonReader reader;

    @Inject
    ConfigService configService;

    /**
     * Generates C code from a JSON tree.
     *
     * @param json Tree dump (JSON text)
     * @param includeAst Whether to include a formatted tree dump in the result (for debugging)
     * @return GenerationResult containing either the code or error details
     */
    public GenerationResult generate(String json, boolean includeAst) {
        ParseResult parseResult = reader.read(json);
        return generate(parseResult, includeAst);
    }

    /**
     * Generates C code from a JSON tree file.
     *
     * @param file Path of the tree dump
     * @return GenerationResult containing either the code or error details
     */
    public GenerationResult generate(Path file) {
        log.debug("Reading tree from file: {}", file);
        return generate(reader.read(file), false);
    }

    private GenerationResult generate(ParseResult parseResult, boolean includeAst) {
        String source = parseResult.getOriginalSource();

        try {
            // STEP 1: Refuse malformed input before generating anything
            if (parseResult.hasErrors()) {
                throw new GenerationException("Malformed input: " + parseResult.getErrorMessage(),
                        "reading tree");
            }
            AstValue tree = parseResult.getTree();

            // STEP 2: Build the generator with the configured indent width
            int indentWidth = configService.getIndentWidth();
            log.debug("Generating code (indent width {})", indentWidth);
            CCodeBuilder builder = new CCodeBuilder(GenerationContext.withIndentWidth(indentWidth));

            // STEP 3: Render
            String code = builder.generate(tree);
            log.info("Successfully generated {} characters of C code", code.length());
            log.trace("Generated code:\n{}", code);

            if (includeAst) {
                return GenerationResult.successWithAst(source, code, AstTreeFormatter.format(tree));
            }
            return GenerationResult.success(source, code);

        } catch (GenerationException e) {
            log.warn("Generation failed: {}", e.getMessage());
            return GenerationResult.failure(source, e);
        } catch (Exception e) {
            log.error("Unexpected error during code generation", e);
            return GenerationResult.failure(source, "Unexpected error: " + e.getMessage());
        }
    }
}
