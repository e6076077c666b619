package com.pgbroker.core;

import java.util.Locale;

public enum PolicyCommand {
    SELECT('r'),
    INSERT('a'),
    UPDATE('w'),
    DELETE('d'),
    ALL('*');

    private final char catalogCode;

    PolicyCommand(char catalogCode) {
        this.catalogCode = catalogCode;
    }

    /** The {@code pg_policy.polcmd} code. */
    public char catalogCode() {
        return catalogCode;
    }

    public boolean covers(PolicyCommand command) {
        return this == ALL || this == command;
    }

    public static PolicyCommand fromCatalogCode(String code) {
        for (PolicyCommand c : values()) {
            if (code != null && code.length() == 1 && code.charAt(0) == c.catalogCode) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown polcmd: " + code);
    }

    public static PolicyCommand parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw BrokerException.validation("command must be one of SELECT, INSERT, UPDATE, DELETE, ALL; got '" + value + "'");
        }
    }
}
