package com.pgbroker.core;

/**
 * Location of the broker's objects: the schema, the message log table and the
 * channel registry view.
 */
public record StoreDescriptor(String schema, String table, String view) {

    public static StoreDescriptor defaults() {
        return new StoreDescriptor("realtime", "messages", "channels");
    }

    public String qualifiedTable() {
        return Identifiers.quote(schema) + "." + Identifiers.quote(table);
    }

    public String qualifiedView() {
        return Identifiers.quote(schema) + "." + Identifiers.quote(view);
    }

    public String displayName() {
        return schema + "." + table;
    }
}
