package io.governor.jdbc.dialect;

import io.governor.jdbc.dead.H2DeadLetterStore;
import io.governor.jdbc.ledger.H2BudgetLedger;
import io.governor.spi.BudgetLedger;
import io.governor.spi.DeadLetterStore;

import java.util.List;

public final class H2Dialect extends JdbcDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }

    @Override
    public BudgetLedger budgetLedger(String tableName) {
        return new H2BudgetLedger(tableName);
    }

    @Override
    public DeadLetterStore deadLetterStore(String tableName) {
        return new H2DeadLetterStore(tableName);
    }
}
