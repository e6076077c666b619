package com.pgbroker.repositories.postgres;

/**
 * Connection settings for the broker database.
 */
public class PostgresConfig {
    public String uri;
    public String username;
    public String password;
    public int maxPoolSize = 10;
    public int minIdle = 1;
}
