package io.governor.jdbc.dead;

/**
 * H2 dead-letter store. Uses the portable SQL from the base class.
 */
public final class H2DeadLetterStore extends AbstractJdbcDeadLetterStore {

    public H2DeadLetterStore() {
        super();
    }

    public H2DeadLetterStore(String tableName) {
        super(tableName);
    }
}
