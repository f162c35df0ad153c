package me.christianrobert.ast2c.analysis.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.ast2c.analysis.model.AnalysisResult;
import me.christianrobert.ast2c.analysis.service.FunctionAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint listing the functions of a JSON syntax tree.
 *
 * <pre>
 * curl -X POST "http://localhost:8080/api/analysis/functions" \
 *   -H "Content-Type: text/plain" \
 *   --data @ast.json
 * </pre>
 *
 * <p>Always returns HTTP 200; check the "success" field.</p>
 */
@Path("/api/analysis")
@Produces(MediaType.APPLICATION_JSON)
public class FunctionAnalysisResource {

    private static final Logger log = LoggerFactory.getLogger(FunctionAnalysisResource.class);

    @Inject
    FunctionAnalysisService functionAnalysisService;

    @POST
    @Path("/functions")
    @Consumes({MediaType.TEXT_PLAIN, MediaType.APPLICATION_JSON})
    public AnalysisResult analyzeFunctions(String json) {
        log.info("Function analysis request received via REST API");

        if (json == null || json.trim().isEmpty()) {
            log.warn("Empty tree received");
            return AnalysisResult.failure("Tree JSON cannot be empty");
        }

        AnalysisResult result = functionAnalysisService.analyze(json);
        if (!result.isSuccess()) {
            log.warn("Function analysis failed: {}", result.getErrorMessage());
        }
        return result;
    }
}
