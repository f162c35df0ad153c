package me.christianrobert.ast2c.tree.parser;

import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstPrimitive;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.NodeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonReaderTest {

    private AstJsonReader reader;

    @BeforeEach
    void setUp() {
        reader = new AstJsonReader();
    }

    @Test
    void objectBecomesNodeWithTagAndOrderedFields() {
        ParseResult result = reader.read("""
                {"_nodetype": "BinaryOp", "op": "+", "left": {"_nodetype": "ID", "name": "a"}, "right": null}
                """);

        assertTrue(result.isSuccess());
        AstNode node = (AstNode) result.getTree();
        assertEquals("BinaryOp", node.getTag());
        assertEquals(NodeTag.BINARY_OPERATION, node.getNodeTag());
        assertEquals(List.of("op", "left", "right"), List.copyOf(node.getFields().keySet()));
        assertFalse(node.has("_nodetype"));
        assertEquals("+", node.getText("op"));
        assertEquals("a", node.getNode("left").getText("name"));
        assertTrue(node.get("right").isAbsent());
    }

    @Test
    void scalarsBecomePrimitiveText() {
        ParseResult result = reader.read("""
                {"_nodetype": "Constant", "value": 42, "flag": true, "ratio": 1.5, "text": "x"}
                """);

        AstNode node = (AstNode) result.getTree();
        assertEquals("42", node.getText("value"));
        assertEquals("true", node.getText("flag"));
        assertEquals("1.5", node.getText("ratio"));
        assertEquals("x", node.getText("text"));
    }

    @Test
    void arraysKeepElementOrderAndMixedKinds() {
        ParseResult result = reader.read("""
                ["int", {"_nodetype": "ID", "name": "n"}, null, []]
                """);

        AstSequence sequence = (AstSequence) result.getTree();
        assertEquals(4, sequence.size());
        assertEquals(AstPrimitive.of("int"), sequence.getElements().get(0));
        assertTrue(sequence.getElements().get(1).isNode());
        assertTrue(sequence.getElements().get(2).isAbsent());
        assertTrue(((AstSequence) sequence.getElements().get(3)).isEmpty());
    }

    @Test
    void missingOrNonTextTagFallsBackToGeneric() {
        AstNode untagged = (AstNode) reader.read("{\"expr\": {\"_nodetype\": \"ID\", \"name\": \"a\"}}").getTree();
        AstNode numericTag = (AstNode) reader.read("{\"_nodetype\": 7}").getTree();
        AstNode unknownTag = (AstNode) reader.read("{\"_nodetype\": \"StaticAssert\"}").getTree();

        assertNull(untagged.getTag());
        assertEquals(NodeTag.GENERIC, untagged.getNodeTag());
        assertNull(numericTag.getTag());
        assertEquals("StaticAssert", unknownTag.getTag());
        assertEquals(NodeTag.GENERIC, unknownTag.getNodeTag());
    }

    @Test
    void emptyInputIsRejected() {
        assertTrue(reader.read("").hasErrors());
        assertTrue(reader.read("   \n").hasErrors());
        assertTrue(reader.read((String) null).hasErrors());
        assertEquals("Input is empty", reader.read("").getErrorMessage());
    }

    @Test
    void malformedJsonIsRejectedWithoutTree() {
        ParseResult result = reader.read("{\"_nodetype\": \"FileAST\", \"ext\": [");

        assertFalse(result.isSuccess());
        assertNull(result.getTree());
        assertTrue(result.getErrorMessage().startsWith("Malformed JSON: "));
        assertTrue(result.getErrorMessage().contains("line 1"));
    }

    @Test
    void trailingContentIsRejected() {
        ParseResult result = reader.read("{\"_nodetype\": \"ID\", \"name\": \"a\"} {}");

        assertTrue(result.hasErrors());
        assertNull(result.getTree());
    }

    @Test
    void scalarRootIsRejected() {
        ParseResult result = reader.read("\"int x;\"");

        assertTrue(result.hasErrors());
        assertEquals("Root must be a JSON object or array", result.getErrorMessage());
    }

    @Test
    void originalSourceIsKept() {
        String json = "{\"_nodetype\": \"ID\", \"name\": \"a\"}";

        assertEquals(json, reader.read(json).getOriginalSource());
        assertEquals("{", reader.read("{").getOriginalSource());
    }

    @Test
    void readsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("ast.json");
        Files.writeString(file, "{\"_nodetype\": \"ID\", \"name\": \"größe\"}", StandardCharsets.UTF_8);

        ParseResult result = reader.read(file);

        assertTrue(result.isSuccess());
        AstValue tree = result.getTree();
        assertEquals("größe", ((AstNode) tree).getText("name"));
    }

    @Test
    void missingFileIsReportedAsError(@TempDir Path dir) {
        ParseResult result = reader.read(dir.resolve("nope.json"));

        assertTrue(result.hasErrors());
        assertTrue(result.getErrorMessage().startsWith("Cannot read file "));
        assertNull(result.getOriginalSource());
    }
}
