package com.pgbroker.repositories.postgres;

import java.util.List;

/**
 * Rendered SQL together with its positional parameters.
 */
public record BoundSql(String sql, List<Object> params) {

    public Object[] paramArray() {
        return params.toArray();
    }
}
