package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.models.CellContent;
import com.spreadsheet.transpiler.models.DependencyNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders dependency trees as indented text, one cell per line:
 * <pre>
 * C1 (A1+B1 => 15)
 * ├── A1 (5)
 * └── B1 (10)
 * </pre>
 * Cells holding a plain number show only the value. A cell whose dependencies
 * were already drawn in the same tree is suffixed "[see above]".
 */
@Component
public class DependencyTreeRenderer {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    public String render(List<DependencyNode> trees) {
        StringBuilder sb = new StringBuilder();
        for (DependencyNode tree : trees) {
            sb.append(label(tree)).append('\n');
            renderChildren(tree, "", sb);
        }
        return sb.toString();
    }

    private void renderChildren(DependencyNode parent, String indent, StringBuilder sb) {
        List<DependencyNode> children = parent.getChildren();
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            DependencyNode child = children.get(i);
            sb.append(indent).append(last ? "└── " : "├── ").append(label(child)).append('\n');
            renderChildren(child, indent + (last ? "    " : "│   "), sb);
        }
    }

    String label(DependencyNode node) {
        String value = node.getValue() != null
                ? CellContent.formatNumber(node.getValue())
                : "error: " + node.getError();
        String text = PLAIN_NUMBER.matcher(node.getExpression()).matches()
                ? node.getCellId() + " (" + value + ")"
                : node.getCellId() + " (" + node.getExpression() + " => " + value + ")";
        if (node.isCircular()) {
            text += " [circular reference]";
        } else if (node.isRepeated()) {
            text += " [see above]";
        }
        return text;
    }
}
