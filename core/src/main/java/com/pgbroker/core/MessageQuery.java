package com.pgbroker.core;

import java.time.Instant;

/**
 * Paging, ordering and filtering for {@link MessageStore#list}. Both dates are
 * inclusive.
 */
public record MessageQuery(
        int limit,
        int offset,
        OrderBy orderBy,
        Direction direction,
        String eventFilter,
        Instant startDate,
        Instant endDate
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    public enum OrderBy {
        CREATED_AT("created_at"),
        ID("id");

        private final String column;

        OrderBy(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }

        public static OrderBy fromColumn(String column) {
            for (OrderBy o : values()) {
                if (o.column.equalsIgnoreCase(column)) {
                    return o;
                }
            }
            throw BrokerException.validation("orderBy must be one of created_at, id; got '" + column + "'");
        }
    }

    public enum Direction {
        ASC, DESC;

        public static Direction parse(String value) {
            if ("asc".equalsIgnoreCase(value)) return ASC;
            if ("desc".equalsIgnoreCase(value)) return DESC;
            throw BrokerException.validation("direction must be asc or desc; got '" + value + "'");
        }
    }

    public MessageQuery {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw BrokerException.validation("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw BrokerException.validation("offset must not be negative");
        }
        if (orderBy == null) orderBy = OrderBy.CREATED_AT;
        if (direction == null) direction = Direction.DESC;
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw BrokerException.validation("startDate must not be after endDate");
        }
    }

    public static MessageQuery defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int limit = DEFAULT_LIMIT;
        private int offset = 0;
        private OrderBy orderBy = OrderBy.CREATED_AT;
        private Direction direction = Direction.DESC;
        private String eventFilter;
        private Instant startDate;
        private Instant endDate;

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder orderBy(OrderBy orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder eventFilter(String eventFilter) {
            this.eventFilter = eventFilter;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public MessageQuery build() {
            return new MessageQuery(limit, offset, orderBy, direction, eventFilter, startDate, endDate);
        }
    }
}
