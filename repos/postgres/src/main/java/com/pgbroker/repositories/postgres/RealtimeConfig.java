package com.pgbroker.repositories.postgres;

import com.pgbroker.core.StoreDescriptor;

/**
 * Names of the broker's database objects and the listener poll interval.
 */
public record RealtimeConfig(
        String schema,
        String messagesTable,
        String channelsView,
        String extension,
        String authenticatedRole,
        long pollIntervalMillis
) {
    public static Builder builder() {
        return new Builder();
    }

    public static RealtimeConfig defaults() {
        return builder().build();
    }

    public StoreDescriptor store() {
        return new StoreDescriptor(schema, messagesTable, channelsView);
    }

    public static class Builder {
        private String schema = "realtime";
        private String messagesTable = "messages";
        private String channelsView = "channels";
        private String extension = "supabase_realtime";
        private String authenticatedRole = "authenticated";
        private long pollIntervalMillis = 500;

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder messagesTable(String messagesTable) {
            this.messagesTable = messagesTable;
            return this;
        }

        public Builder channelsView(String channelsView) {
            this.channelsView = channelsView;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder authenticatedRole(String authenticatedRole) {
            this.authenticatedRole = authenticatedRole;
            return this;
        }

        public Builder pollIntervalMillis(long pollIntervalMillis) {
            this.pollIntervalMillis = pollIntervalMillis;
            return this;
        }

        public RealtimeConfig build() {
            return new RealtimeConfig(schema, messagesTable, channelsView, extension, authenticatedRole, pollIntervalMillis);
        }
    }
}
