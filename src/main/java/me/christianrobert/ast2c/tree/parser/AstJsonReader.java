package me.christianrobert.ast2c.tree.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.Dependent;
import me.christianrobert.ast2c.tree.AstAbsent;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstPrimitive;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads JSON syntax-tree dumps into the {@link AstValue} model.
 *
 * <p>Mapping:</p>
 * <ul>
 *   <li>JSON object: {@link AstNode}; the {@code _nodetype} member is the tag, every other member
 *       becomes a field in document order</li>
 *   <li>JSON array: {@link AstSequence}, element order kept</li>
 *   <li>string, number, boolean: {@link AstPrimitive} holding the value's text</li>
 *   <li>{@code null}: {@link AstAbsent}</li>
 * </ul>
 *
 * <p>Never throws for bad input. Syntax errors and unusable roots are reported through
 * {@link ParseResult#getErrors()} so callers can refuse to generate from a partial tree.</p>
 *
 * <p>Uses @Dependent scope because it is stateless and is both injected and created with new.</p>
 */
@Dependent
public class AstJsonReader {

    private static final Logger log = LoggerFactory.getLogger(AstJsonReader.class);

    public static final String TAG_FIELD = "_nodetype";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Reads a tree from JSON text.
     *
     * @param json JSON document
     * @return ParseResult containing the tree root or the errors
     */
    public ParseResult read(String json) {
        if (json == null || json.trim().isEmpty()) {
            return ParseResult.failure("Input is empty", json);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("JSON syntax error: {}", e.getOriginalMessage());
            return ParseResult.failure(describe(e), json);
        }

        if (root == null || !(root.isObject() || root.isArray())) {
            return ParseResult.failure("Root must be a JSON object or array", json);
        }

        AstValue tree = convert(root);
        log.trace("Read tree root: {}", tree);
        return ParseResult.success(tree, json);
    }

    /**
     * Reads a tree from a UTF-8 file.
     *
     * @param file path of the JSON document
     * @return ParseResult containing the tree root or the errors
     */
    public ParseResult read(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read tree file {}: {}", file, e.getMessage());
            return ParseResult.failure("Cannot read file " + file + ": " + e.getMessage(), null);
        }
        return read(json);
    }

    private AstValue convert(JsonNode json) {
        switch (json.getNodeType()) {
            case OBJECT:
                return convertObject(json);
            case ARRAY:
                List<AstValue> elements = new ArrayList<>(json.size());
                for (JsonNode element : json) {
                    elements.add(convert(element));
                }
                return AstSequence.of(elements);
            case NULL:
            case MISSING:
                return AstAbsent.INSTANCE;
            default:
                // STRING, NUMBER, BOOLEAN, BINARY, POJO
                return AstPrimitive.of(json.asText());
        }
    }

    private AstNode convertObject(JsonNode json) {
        JsonNode tagNode = json.get(TAG_FIELD);
        String tag = tagNode != null && tagNode.isTextual() ? tagNode.asText() : null;

        AstNode.Builder builder = AstNode.builder(tag);
        Iterator<Map.Entry<String, JsonNode>> members = json.fields();
        while (members.hasNext()) {
            Map.Entry<String, JsonNode> member = members.next();
            if (TAG_FIELD.equals(member.getKey())) {
                continue;
            }
            builder.field(member.getKey(), convert(member.getValue()));
        }
        return builder.build();
    }

    private static String describe(JsonProcessingException e) {
        StringBuilder message = new StringBuilder("Malformed JSON: ").append(e.getOriginalMessage());
        if (e.getLocation() != null) {
            message.append(" (line ").append(e.getLocation().getLineNr())
                    .append(", column ").append(e.getLocation().getColumnNr()).append(")");
        }
        return message.toString();
    }
}
