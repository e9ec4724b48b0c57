package io.governor.jdbc.dialect;

import io.governor.jdbc.dead.PostgresDeadLetterStore;
import io.governor.jdbc.ledger.PostgresBudgetLedger;
import io.governor.spi.BudgetLedger;
import io.governor.spi.DeadLetterStore;

import java.util.List;

/**
 * PostgreSQL: upsert-based reservation and {@code RETURNING} replay claims.
 */
public final class PostgresDialect extends JdbcDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public BudgetLedger budgetLedger(String tableName) {
        return new PostgresBudgetLedger(tableName);
    }

    @Override
    public DeadLetterStore deadLetterStore(String tableName) {
        return new PostgresDeadLetterStore(tableName);
    }
}
