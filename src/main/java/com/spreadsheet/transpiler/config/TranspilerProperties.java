package com.spreadsheet.transpiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the "transpiler" prefix, e.g. in application.properties:
 * <pre>
 * transpiler.sheet-index=-1
 * transpiler.self-check-before-write=true
 * </pre>
 */
@ConfigurationProperties(prefix = "transpiler")
public class TranspilerProperties {

    /** Workbook sheet to convert; -1 selects the workbook's active sheet. */
    private int sheetIndex = -1;

    /** Evaluate the first formula cell before writing a program out, and refuse to write if it fails. */
    private boolean selfCheckBeforeWrite = true;

    public int getSheetIndex() {
        return sheetIndex;
    }

    public void setSheetIndex(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }

    public boolean isSelfCheckBeforeWrite() {
        return selfCheckBeforeWrite;
    }

    public void setSelfCheckBeforeWrite(boolean selfCheckBeforeWrite) {
        this.selfCheckBeforeWrite = selfCheckBeforeWrite;
    }
}
