package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.models.CellId;
import org.apache.poi.ss.SpreadsheetVersion;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites one spreadsheet formula (without its leading "=") into the
 * target expression grammar.
 * <p>
 * The rewrite steps run in a fixed order, each one on the output of the previous:
 * 1) comma-decimal percentages  "10,5%"     -> "10.5/100"
 * 2) plain percentages          "20%"       -> "20/100"
 * 3) single-row range sums      "SUM(B2:D2)" -> "B2+C2+D2"
 * 4) function renames           "MIN"/"MAX" -> "Math.min"/"Math.max"
 * 5) comma-decimal numbers      "1,5"       -> "1.5"
 * 6) absolute markers           "$A$1"      -> "A1"
 * <p>
 * Translation never fails. Anything it does not understand is passed through
 * unchanged and will only be reported when the program is evaluated.
 */
@Service
public class ExpressionTranslator {

    private static final Pattern COMMA_PERCENT = Pattern.compile("(\\d+),(\\d+)%");
    private static final Pattern PERCENT = Pattern.compile("(\\d+)%");
    private static final Pattern RANGE_SUM =
            Pattern.compile("SUM\\(\\$?([A-Z]+)\\$?(\\d+):\\$?([A-Z]+)\\$?(\\d+)\\)");
    private static final Pattern COMMA_DECIMAL = Pattern.compile("(\\d+),(\\d+)");

    /**
     * Applies every rewrite step, in order.
     */
    public String translate(String formula) {
        if (formula == null) {
            return "";
        }
        String expression = convertCommaPercentages(formula);
        expression = convertPercentages(expression);
        expression = expandRangeSums(expression);
        expression = renameFunctions(expression);
        expression = convertCommaDecimals(expression);
        return stripAbsoluteMarkers(expression);
    }

    /**
     * "10,5%" -> "10.5/100". The comma is the locale's decimal separator,
     * so the integer and fraction digits are joined and the percent applied.
     */
    String convertCommaPercentages(String formula) {
        return COMMA_PERCENT.matcher(formula).replaceAll(m -> {
            String number = stripLeadingZeros(m.group(1)) + "." + m.group(2);
            return Matcher.quoteReplacement(number + "/100");
        });
    }

    /**
     * "20%" -> "20/100".
     */
    String convertPercentages(String formula) {
        return PERCENT.matcher(formula).replaceAll(m -> stripLeadingZeros(m.group(1)) + "/100");
    }

    /**
     * Expands "SUM(B2:D2)" into "B2+C2+D2".
     * Only ranges inside one row are expanded; anything else is left as written,
     * as are ranges reaching past the last column of an .xlsx sheet (XFD).
     * The columns run from the first reference to the second: if the second
     * column comes before the first, the expansion has no terms at all.
     */
    String expandRangeSums(String formula) {
        return RANGE_SUM.matcher(formula).replaceAll(m -> {
            if (!expandable(m)) {
                return Matcher.quoteReplacement(m.group());
            }
            List<CellId> cells = expandRow(m.group(1), m.group(3), Integer.parseInt(m.group(2)));
            List<String> terms = new ArrayList<>(cells.size());
            cells.forEach(c -> terms.add(c.toString()));
            return String.join("+", terms);
        });
    }

    /**
     * Case-sensitive substring rename; argument lists are not inspected.
     */
    String renameFunctions(String formula) {
        return formula.replace("MIN", "Math.min").replace("MAX", "Math.max");
    }

    /**
     * "1,5" -> "1.5".
     */
    String convertCommaDecimals(String formula) {
        return COMMA_DECIMAL.matcher(formula).replaceAll("$1.$2");
    }

    String stripAbsoluteMarkers(String formula) {
        return formula.replace("$", "");
    }

    /**
     * Lists the cells a single-row range sum of the formula expands to,
     * in the same order the translation writes them. Cells of unsupported
     * ranges are not listed.
     */
    public List<CellId> rangeSumCells(String formula) {
        List<CellId> cells = new ArrayList<>();
        if (formula == null) {
            return cells;
        }
        Matcher m = RANGE_SUM.matcher(formula);
        while (m.find()) {
            if (expandable(m)) {
                cells.addAll(expandRow(m.group(1), m.group(3), Integer.parseInt(m.group(2))));
            }
        }
        return cells;
    }

    private static List<CellId> expandRow(String fromColumn, String toColumn, int row) {
        int from = CellId.columnIndex(fromColumn);
        int to = CellId.columnIndex(toColumn);
        List<CellId> cells = new ArrayList<>();
        for (int column = from; column <= to; column++) {
            cells.add(CellId.of(column, row));
        }
        return cells;
    }

    // One row, and both columns exist in an .xlsx sheet
    private static boolean expandable(MatchResult m) {
        return sameRow(m.group(2), m.group(4)) && withinSheet(m.group(1)) && withinSheet(m.group(3));
    }

    private static boolean withinSheet(String columnLetters) {
        SpreadsheetVersion version = SpreadsheetVersion.EXCEL2007;
        return columnLetters.length() <= version.getLastColumnName().length()
                && CellId.columnIndex(columnLetters) <= version.getLastColumnIndex() + 1;
    }

    private static boolean sameRow(String first, String second) {
        try {
            return Integer.parseInt(first) == Integer.parseInt(second) && Integer.parseInt(first) > 0;
        } catch (NumberFormatException e) {
            // Row numbers that overflow an int are not cells we can declare
            return false;
        }
    }

    private static String stripLeadingZeros(String digits) {
        String stripped = digits.replaceFirst("^0+(?=\\d)", "");
        return stripped.isEmpty() ? "0" : stripped;
    }
}
