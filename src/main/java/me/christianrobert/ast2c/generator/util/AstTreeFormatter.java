package me.christianrobert.ast2c.generator.util;

import me.christianrobert.ast2c.tree.AstNode;
import me.christianrobert.ast2c.tree.AstPrimitive;
import me.christianrobert.ast2c.tree.AstSequence;
import me.christianrobert.ast2c.tree.AstValue;

import java.util.Map;

/**
 * Formats syntax trees into a human-readable, indented text representation.
 *
 * <p>Useful for debugging what the generator received. Example output:</p>
 * <pre>
 * FileAST
 *   ext: [1]
 *     Decl
 *       name: "x"
 *       type: TypeDecl
 *         declname: "x"
 *         type: IdentifierType
 *           names: [1]
 *             "int"
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a tree into human-readable text.
   *
   * @param tree Root of the tree
   * @return Formatted string representation
   */
  public static String format(AstValue tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatValue(tree, 0, sb);
    return sb.toString();
  }

  private static void formatValue(AstValue value, int depth, StringBuilder sb) {
    switch (value.getKind()) {
      case NODE:
        AstNode node = (AstNode) value;
        sb.append(node.getTag() != null ? node.getTag() : "(untagged)").append("\n");
        for (Map.Entry<String, AstValue> field : node.getFields().entrySet()) {
          indent(depth + 1, sb);
          sb.append(field.getKey()).append(": ");
          formatValue(field.getValue(), depth + 1, sb);
        }
        break;
      case SEQUENCE:
        AstSequence sequence = (AstSequence) value;
        sb.append("[").append(sequence.size()).append("]\n");
        for (AstValue element : sequence.getElements()) {
          indent(depth + 1, sb);
          formatValue(element, depth + 1, sb);
        }
        break;
      case PRIMITIVE:
        sb.append("\"").append(escapeAndTruncate(((AstPrimitive) value).getText())).append("\"\n");
        break;
      case ABSENT:
        sb.append("null\n");
        break;
    }
  }

  private static void indent(int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
  }

  /**
   * Escapes special characters and truncates long text.
   */
  private static String escapeAndTruncate(String text) {
    String escaped = text
        .replace("\\", "\\\\")
        .replace("\n", "\\n")
        .replace("\r", "\\r")
        .replace("\t", "\\t");

    if (escaped.length() > MAX_TEXT_LENGTH) {
      return escaped.substring(0, MAX_TEXT_LENGTH - 3) + "...";
    }
    return escaped;
  }
}
