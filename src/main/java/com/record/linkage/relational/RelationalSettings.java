package com.record.linkage.relational;

/**
 * Connection settings of the optional relational candidate store.
 * When a run has no relational settings, candidates are generated in memory.
 */
public class RelationalSettings {

    private static final int DEFAULT_POOL_SIZE = 2;
    public static final int DEFAULT_INSERT_BATCH_SIZE = 1_000;

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final String schema;
    private final int poolSize;
    private final int insertBatchSize;

    private RelationalSettings(Builder builder) {
        this.jdbcUrl = builder.jdbcUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.schema = builder.schema;
        this.poolSize = builder.poolSize;
        this.insertBatchSize = builder.insertBatchSize;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /**
     * Schema holding staged record tables and candidate tables, or {@code null}
     * for the connection's default schema.
     */
    public String getSchema() {
        return schema;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String jdbcUrl;
        private String username;
        private String password;
        private String schema;
        private int poolSize = DEFAULT_POOL_SIZE;
        private int insertBatchSize = DEFAULT_INSERT_BATCH_SIZE;

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder schema(String schema) {
            if (schema != null && !schema.isBlank()) {
                SqlIdentifiers.requireValid(schema);
            }
            this.schema = schema == null || schema.isBlank() ? null : schema;
            return this;
        }

        public Builder poolSize(int poolSize) {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive");
            }
            this.poolSize = poolSize;
            return this;
        }

        public Builder insertBatchSize(int insertBatchSize) {
            if (insertBatchSize <= 0) {
                throw new IllegalArgumentException("insertBatchSize must be positive");
            }
            this.insertBatchSize = insertBatchSize;
            return this;
        }

        public RelationalSettings build() {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new IllegalArgumentException("jdbcUrl is required");
            }
            return new RelationalSettings(this);
        }
    }

    @Override
    public String toString() {
        return "RelationalSettings{" +
                "jdbcUrl='" + jdbcUrl + '\'' +
                ", username='" + username + '\'' +
                ", schema='" + schema + '\'' +
                ", poolSize=" + poolSize +
                ", insertBatchSize=" + insertBatchSize +
                '}';
    }
}
