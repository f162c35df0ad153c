package me.christianrobert.ast2c.analysis.service;

import me.christianrobert.ast2c.analysis.model.AnalysisReport;
import me.christianrobert.ast2c.analysis.model.FunctionSummary;
import me.christianrobert.ast2c.analysis.model.ParameterSummary;
import me.christianrobert.ast2c.generator.context.GenerationException;
import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstPrimitive;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;
import me.christianrobert.ast2c.tree.NodeTag;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts function signatures and body statistics from a translation unit.
 *
 * <p>Counts as a function:</p>
 * <ul>
 *   <li>every top-level function definition</li>
 *   <li>every top-level declaration whose type is a function declarator (prototype)</li>
 * </ul>
 *
 * <p>Types are summarized, not rendered: the first token of the base type name, prefixed with
 * one {@code *} per pointer level ({@code char *s} → {@code *char}). Anything that is not a
 * type construct summarizes as {@code unknown}.</p>
 */
public final class FunctionAnalyzer {

    static final String UNKNOWN = "unknown";
    static final String ANONYMOUS = "anonymous";

    private FunctionAnalyzer() {
    }

    /**
     * Analyzes the top-level functions of a translation unit.
     *
     * @param root Tree root; must be a node with an {@code ext} sequence
     * @return Report with one summary per function, in source order
     * @throws GenerationException if the root has no {@code ext} sequence
     */
    public static AnalysisReport analyze(AstValue root) {
        if (!root.isNode() || !((AstNode) root).get("ext").isSequence()) {
            throw new GenerationException("Root node has no 'ext' sequence of top-level declarations",
                    "function analysis");
        }

        List<FunctionSummary> functions = new ArrayList<>();
        for (AstValue external : ((AstNode) root).getSequence("ext").getElements()) {
            if (!external.isNode()) {
                continue;
            }
            AstNode node = (AstNode) external;
            if (node.is(NodeTag.FUNCTION_DEFINITION)) {
                functions.add(summarizeDefinition(node));
            } else if (node.is(NodeTag.DECLARATION) && isFunctionDeclarator(node.getNode("type"))) {
                functions.add(summarizeDeclaration(node));
            }
        }
        return new AnalysisReport(functions);
    }

    private static FunctionSummary summarizeDefinition(AstNode definition) {
        AstNode decl = definition.getNode("decl");
        String name = decl != null ? decl.getText("name", UNKNOWN) : UNKNOWN;
        AstNode type = decl != null ? decl.getNode("type") : null;
        return FunctionSummary.definition(name, extractType(type), extractParameters(type),
                countIfStatements(definition.get("body")));
    }

    private static FunctionSummary summarizeDeclaration(AstNode decl) {
        AstNode type = decl.getNode("type");
        return FunctionSummary.declaration(decl.getText("name", UNKNOWN), extractType(type), extractParameters(type));
    }

    /**
     * Summarizes a type construct.
     *
     * @param type Type node (may be null)
     * @return First base-type token with pointer prefixes, or "unknown"
     */
    static String extractType(AstValue type) {
        if (type == null || !type.isNode()) {
            return UNKNOWN;
        }
        AstNode node = (AstNode) type;
        switch (node.getNodeTag()) {
            case IDENTIFIER_TYPE:
                AstSequence names = node.getSequence("names");
                if (names.isEmpty() || !names.getElements().get(0).isPrimitive()) {
                    return UNKNOWN;
                }
                return ((AstPrimitive) names.getElements().get(0)).getText();
            case TYPE_DECLARATOR:
            case TYPE_REFERENCE:
            case FUNCTION_DECLARATOR:
                return extractType(node.get("type"));
            case POINTER_DECLARATOR:
                return "*" + extractType(node.get("type"));
            default:
                return UNKNOWN;
        }
    }

    /**
     * Lists the parameters of a function declarator, or null if it has no parameter list.
     */
    static List<ParameterSummary> extractParameters(AstNode funcDecl) {
        if (funcDecl == null) {
            return null;
        }
        AstNode args = funcDecl.getNode("args");
        if (args == null || !args.get("params").isSequence()) {
            return null;
        }

        List<ParameterSummary> parameters = new ArrayList<>();
        for (AstValue param : args.getSequence("params").getElements()) {
            if (!param.isNode()) {
                parameters.add(new ParameterSummary(UNKNOWN, ANONYMOUS));
                continue;
            }
            AstNode paramNode = (AstNode) param;
            parameters.add(new ParameterSummary(extractType(paramNode.get("type")),
                    paramNode.getText("name", ANONYMOUS)));
        }
        return parameters;
    }

    /**
     * Counts IF nodes anywhere below the given value.
     */
    static int countIfStatements(AstValue value) {
        switch (value.getKind()) {
            case NODE:
                AstNode node = (AstNode) value;
                int count = node.is(NodeTag.CONDITIONAL) ? 1 : 0;
                for (AstValue child : node.getFields().values()) {
                    count += countIfStatements(child);
                }
                return count;
            case SEQUENCE:
                int total = 0;
                for (AstValue element : ((AstSequence) value).getElements()) {
                    total += countIfStatements(element);
                }
                return total;
            default:
                return 0;
        }
    }

    private static boolean isFunctionDeclarator(AstNode type) {
        return type != null && type.is(NodeTag.FUNCTION_DECLARATOR);
    }
}
