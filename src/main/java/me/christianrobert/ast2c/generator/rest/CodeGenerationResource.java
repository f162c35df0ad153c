package me.christianrobert.ast2c.generator.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.ast2c.config.service.ConfigService;
import me.christianrobert.ast2c.generator.context.GenerationResult;
import me.christianrobert.ast2c.generator.service.CodeGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for C code generation from JSON syntax trees.
 *
 * <p>Usage:
 * <pre>
 * curl -X POST "http://localhost:8080/api/generation/c" \
 *   -H "Content-Type: text/plain" \
 *   --data @ast.json
 *
 * # Include the formatted tree in the response
 * curl -X POST "http://localhost:8080/api/generation/c?showAst=true" \
 *   -H "Content-Type: text/plain" \
 *   --data @ast.json
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": true,
 *   "code": "int x;",
 *   "errorMessage": null,
 *   ...
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * Malformed input is a valid business outcome, not an HTTP error.
 */
@Path("/api/generation")
@Produces(MediaType.APPLICATION_JSON)
public class CodeGenerationResource {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerationResource.class);

    @Inject
    CodeGenerationService codeGenerationService;

    @Inject
    ConfigService configService;

    /**
     * Generates C code from a JSON tree.
     *
     * @param showAst Optional flag to include the tree dump (defaults to the configured setting)
     * @param json Tree dump (text/plain or application/json body)
     * @return GenerationResult as JSON (always HTTP 200, check "success" field)
     */
    @POST
    @Path("/c")
    @Consumes({MediaType.TEXT_PLAIN, MediaType.APPLICATION_JSON})
    public GenerationResult generate(@QueryParam("showAst") Boolean showAst, String json) {
        log.info("Code generation request received via REST API");
        log.trace("Tree JSON: {}", json);

        if (json == null || json.trim().isEmpty()) {
            log.warn("Empty tree received");
            return GenerationResult.failure("", "Tree JSON cannot be empty");
        }

        boolean includeAst = showAst != null ? showAst : configService.isShowAstByDefault();
        GenerationResult result = codeGenerationService.generate(json, includeAst);

        if (result.isSuccess()) {
            log.info("Code generation succeeded");
        } else {
            log.warn("Code generation failed: {}", result.getErrorMessage());
        }
        return result;
    }
}
