package io.governor.jdbc.dialect;

import io.governor.jdbc.TableNames;
import io.governor.jdbc.catalog.JdbcCatalogStore;
import io.governor.spi.BudgetLedger;
import io.governor.spi.CatalogStore;
import io.governor.spi.DeadLetterStore;

import java.util.List;

/**
 * A database flavour: matches JDBC URLs and builds the stores that speak its SQL.
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/io.governor.jdbc.dialect.JdbcDialect} and looked up
 * through {@link JdbcDialects}.
 */
public abstract class JdbcDialect {

    /** Short dialect name, e.g. {@code "h2"}. Case-insensitive for lookup. */
    public abstract String name();

    /** JDBC URL prefixes this dialect handles. */
    public abstract List<String> jdbcUrlPrefixes();

    public abstract BudgetLedger budgetLedger(String tableName);

    public abstract DeadLetterStore deadLetterStore(String tableName);

    public BudgetLedger budgetLedger() {
        return budgetLedger(TableNames.BUDGET_LEDGER);
    }

    public DeadLetterStore deadLetterStore() {
        return deadLetterStore(TableNames.DEAD_LETTER);
    }

    public CatalogStore catalogStore(String catalogTable, String deadLetterTable) {
        return new JdbcCatalogStore(catalogTable, deadLetterTable);
    }

    public CatalogStore catalogStore() {
        return catalogStore(TableNames.CATALOG, TableNames.DEAD_LETTER);
    }

    @Override
    public String toString() {
        return name();
    }
}
