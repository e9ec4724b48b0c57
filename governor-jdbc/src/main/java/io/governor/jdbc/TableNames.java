package io.governor.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation for the JDBC stores.
 */
public final class TableNames {
    public static final String BUDGET_LEDGER = "budget_ledger";
    public static final String DEAD_LETTER = "dead_letter";
    public static final String CATALOG = "catalog";

    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private TableNames() {}

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
