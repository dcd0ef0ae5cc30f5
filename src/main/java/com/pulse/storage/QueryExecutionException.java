package com.pulse.storage;

/**
 * Exception thrown when a relational query fails.
 * Carries the offending query text and its bound parameters.
 */
public class QueryExecutionException extends RuntimeException {

    private final String query;
    private final String params;

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.query = null;
        this.params = null;
    }

    public QueryExecutionException(String message, String query, String params, Throwable cause) {
        super(message, cause);
        this.query = query;
        this.params = params;
    }

    /**
     * The database's own message, without the query context appended.
     */
    public String getDatabaseMessage() {
        return super.getMessage();
    }

    public String getQuery() {
        return query;
    }

    /**
     * @return bound parameters as a JSON array, or null
     */
    public String getParams() {
        return params;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        if (params != null) {
            sb.append(" [Params: ").append(params).append("]");
        }
        return sb.toString();
    }
}
