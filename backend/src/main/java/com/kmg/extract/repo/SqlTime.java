package com.kmg.extract.repo;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Timestamps in the runs table are ISO-8601 text in UTC, so lexical order matches time order.
 */
final class SqlTime {
    private SqlTime() {
    }

    static String nowText() {
        return OffsetDateTime.now(ZoneOffset.UTC).toString();
    }

    static String toText(OffsetDateTime value) {
        return value == null ? null : value.withOffsetSameInstant(ZoneOffset.UTC).toString();
    }

    static OffsetDateTime read(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null || value.isBlank()) {
            return null;
        }
        return OffsetDateTime.parse(value);
    }
}
