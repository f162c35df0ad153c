package me.christianrobert.ast2c.analysis.service;

import me.christianrobert.ast2c.analysis.model.AnalysisResult;
import me.christianrobert.ast2c.tree.parser.AstJsonReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FunctionAnalysisServiceTest {

    private static final String PROTOTYPE = """
            {"_nodetype": "FileAST", "ext": [
              {"_nodetype": "Decl", "name": "square",
               "type": {"_nodetype": "FuncDecl",
                        "args": {"_nodetype": "ParamList", "params": [
                          {"_nodetype": "Decl", "name": "n",
                           "type": {"_nodetype": "TypeDecl", "declname": "n",
                                    "type": {"_nodetype": "IdentifierType", "names": ["long"]}}}
                        ]},
                        "type": {"_nodetype": "TypeDecl", "declname": "square",
                                 "type": {"_nodetype": "IdentifierType", "names": ["long"]}}},
               "init": null}
            ]}
            """;

    private FunctionAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new FunctionAnalysisService();
        service.reader = new AstJsonReader();
    }

    @Test
    void analyzesPrototype() {
        AnalysisResult result = service.analyze(PROTOTYPE);

        assertTrue(result.isSuccess());
        assertEquals("""
                Function: square
                Return Type: long
                Parameters:
                    long n

                Total number of functions: 1
                """, result.getText());
    }

    @Test
    void malformedInputIsRefused() {
        AnalysisResult result = service.analyze("{\"ext\": [");

        assertFalse(result.isSuccess());
        assertNull(result.getText());
        assertTrue(result.getErrorMessage().startsWith("Malformed input: "));
    }

    @Test
    void rootWithoutExternalsFails() {
        AnalysisResult result = service.analyze("{\"_nodetype\": \"FileAST\"}");

        assertFalse(result.isSuccess());
        assertTrue(result.getErrorMessage().contains("Context: function analysis"));
    }

    @Test
    void analyzesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("ast.json");
        Files.writeString(file, PROTOTYPE);

        assertEquals(1, service.analyze(file).getReport().getTotalFunctions());
    }
}
