package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.models.CellDeclaration;
import com.spreadsheet.transpiler.models.CellId;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Joins declarations into program text, one statement per line, in definition order.
 * Cells without a declaration are skipped.
 */
@Service
public class ProgramAssembler {

    public String assemble(List<CellId> definitionOrder, Map<CellId, CellDeclaration> declarations) {
        List<String> lines = new ArrayList<>(definitionOrder.size());
        for (CellId cellId : definitionOrder) {
            CellDeclaration declaration = declarations.get(cellId);
            if (declaration != null) {
                lines.add(declaration.toStatement());
            }
        }
        return String.join("\n", lines);
    }
}
