package me.christianrobert.ast2c.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.ast2c.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoint for reading and changing generator settings at runtime.
 *
 * <pre>
 * curl http://localhost:8080/api/config
 * curl -X PUT "http://localhost:8080/api/config/generator.indent-width" \
 *   -H "Content-Type: application/json" --data '{"value": 2}'
 * </pre>
 *
 * <p>Values for known generator keys are validated; a rejected request changes nothing.</p>
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.debug("Listing generator settings");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> changes) {
        if (changes == null || changes.isEmpty()) {
            return badRequest(List.of("Request body must contain at least one setting"));
        }

        List<String> problems = new ArrayList<>();
        changes.forEach((key, value) -> configService.validate(key, value).ifPresent(problems::add));
        if (!problems.isEmpty()) {
            log.warn("Rejected settings update: {}", problems);
            return badRequest(problems);
        }

        configService.updateConfiguration(changes);
        return Response.ok(outcome("Saved " + changes.size() + " settings")).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Unknown setting: " + key))
                    .build();
        }
        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        if (body == null || !body.containsKey("value")) {
            return badRequest(List.of("Request body must contain a 'value' field"));
        }

        Object value = body.get("value");
        var problem = configService.validate(key, value);
        if (problem.isPresent()) {
            log.warn("Rejected value for {}: {}", key, problem.get());
            return badRequest(List.of(problem.get()));
        }

        configService.setConfigValue(key, value);
        Map<String, Object> response = new HashMap<>(outcome("Updated " + key));
        response.put("key", key);
        response.put("value", value);
        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        return Response.ok(outcome("Settings reset to defaults")).build();
    }

    private static Response badRequest(List<String> errors) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of("status", "error", "errors", errors))
                .build();
    }

    private static Map<String, String> outcome(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", message);
        return response;
    }
}
