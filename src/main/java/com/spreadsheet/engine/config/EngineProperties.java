package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine limits, bound from {@code spreadsheet.engine.*} in application.properties.
 * The defaults apply when a property is absent or when the service is built by hand.
 */
@ConfigurationProperties(prefix = "spreadsheet.engine")
public class EngineProperties {

    private int maxRows = 1000;
    private int maxColumns = 1000;

    // Shared by the parser nesting limit, the cycle search and the chain depth of a pass
    private int maxDepth = 100;

    private int displayPrecision = 5;

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getDisplayPrecision() {
        return displayPrecision;
    }

    public void setDisplayPrecision(int displayPrecision) {
        this.displayPrecision = displayPrecision;
    }
}
