package io.governor.jdbc.ledger;

/**
 * H2 budget ledger. Uses the portable conditional-update protocol.
 */
public final class H2BudgetLedger extends AbstractJdbcBudgetLedger {

    public H2BudgetLedger() {
        super();
    }

    public H2BudgetLedger(String tableName) {
        super(tableName);
    }
}
