package com.example.fssnapshot.store;

/**
 * Failure of the version store, carrying the operation and the SQL that was attempted.
 */
public class StoreException extends Exception {
    private final String operation;
    private final String sql;

    public StoreException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
        this.sql = null;
    }

    public StoreException(String operation, String sql, Throwable cause) {
        super(operation + " failed: " + cause.getMessage()
                + (sql == null ? "" : System.lineSeparator() + "The following sql was attempted:"
                + System.lineSeparator() + sql.strip()), cause);
        this.operation = operation;
        this.sql = sql;
    }

    public String operation() {
        return operation;
    }

    public String sql() {
        return sql;
    }
}
