package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.exceptions.InvalidCellReferenceException;
import com.spreadsheet.transpiler.models.CellId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the cell references in a formula's source text.
 * <p>
 * A reference is one or more uppercase letters followed by one or more digits,
 * with an optional "$" before either part ("B2", "$B$2", "B$2").
 * Unlike a plain regular expression over the raw text, the scanner walks the
 * formula token by token so that it
 * - skips double-quoted string literals ("=\"A1\"" references nothing),
 * - ignores function names that happen to end in digits ("LOG10(" is a call),
 * - does not match inside longer identifiers ("XA1B" is not a reference).
 */
@Component
public class ReferenceScanner {

    /**
     * Distinct references in order of first appearance, markers stripped.
     */
    public List<CellId> scan(String formula) {
        Set<CellId> references = new LinkedHashSet<>();
        if (formula == null) {
            return new ArrayList<>();
        }
        int length = formula.length();
        int i = 0;
        while (i < length) {
            char c = formula.charAt(i);
            if (c == '"') {
                i = skipString(formula, i);
                continue;
            }
            if (isWordChar(c) || c == '$') {
                int end = wordEnd(formula, i);
                CellId reference = toReference(formula, i, end);
                if (reference != null) {
                    references.add(reference);
                }
                i = end;
                continue;
            }
            i++;
        }
        return new ArrayList<>(references);
    }

    // Returns the index just past the closing quote; "" inside a string is an escaped quote
    private static int skipString(String formula, int start) {
        int i = start + 1;
        while (i < formula.length()) {
            if (formula.charAt(i) == '"') {
                if (i + 1 < formula.length() && formula.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private static int wordEnd(String formula, int start) {
        int i = start;
        while (i < formula.length() && (isWordChar(formula.charAt(i)) || formula.charAt(i) == '$')) {
            i++;
        }
        return i;
    }

    private static CellId toReference(String formula, int start, int end) {
        String word = formula.substring(start, end);
        if (end < formula.length() && formula.charAt(end) == '(') {
            // Function call such as LOG10(...)
            return null;
        }
        if (start > 0 && formula.charAt(start - 1) == '.') {
            // Member access or decimal part, never a reference
            return null;
        }
        int i = 0;
        if (i < word.length() && word.charAt(i) == '$') {
            i++;
        }
        int lettersStart = i;
        while (i < word.length() && word.charAt(i) >= 'A' && word.charAt(i) <= 'Z') {
            i++;
        }
        if (i == lettersStart) {
            return null;
        }
        if (i < word.length() && word.charAt(i) == '$') {
            i++;
        }
        int digitsStart = i;
        while (i < word.length() && Character.isDigit(word.charAt(i))) {
            i++;
        }
        if (i == digitsStart || i != word.length()) {
            return null;
        }
        try {
            return CellId.parse(word);
        } catch (InvalidCellReferenceException e) {
            // Row number beyond what a sheet can hold: not a usable reference
            return null;
        }
    }

    private static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
    }
}
