package com.pgbroker.repositories.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ErrorKind;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions between JDBC values and the plain Java values broker rows carry.
 */
public interface Converters {
    ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Converts the current row of a ResultSet into an ordered map keyed by column label.
     */
    static Map<String, Object> resultSetToRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i), fromJdbc(rs.getObject(i)));
        }
        return row;
    }

    static Object fromJdbc(Object value) throws SQLException {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof PGobject) {
            PGobject pg = (PGobject) value;
            if ("json".equals(pg.getType()) || "jsonb".equals(pg.getType())) {
                return parseJson(pg.getValue());
            }
            return pg.getValue();
        }
        if (value instanceof Array) {
            Object[] elements = (Object[]) ((Array) value).getArray();
            return Arrays.asList(elements);
        }
        return value;
    }

    static Object toJdbc(Object value) {
        if (value instanceof Instant) {
            return instantToTimestamp((Instant) value);
        }
        return value;
    }

    static Object parseJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, new TypeReference<Object>() {});
        } catch (JsonProcessingException e) {
            throw new BrokerException(ErrorKind.BACKEND, "Unreadable JSON value: " + e.getOriginalMessage(), e);
        }
    }

    static String toJson(Map<String, Object> value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BrokerException(ErrorKind.VALIDATION, "Payload is not serialisable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    static Timestamp instantToTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
