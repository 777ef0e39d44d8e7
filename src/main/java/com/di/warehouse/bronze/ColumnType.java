package com.di.warehouse.bronze;

import com.di.warehouse.util.DateFormatUtils;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;

/**
 * Type of a Bronze column and how a CSV field converts into it.
 * An empty field is NULL for every type; text keeps its surrounding whitespace.
 */
public enum ColumnType {

    INT(Types.INTEGER) {
        @Override
        Object convert(String raw) {
            return Integer.valueOf(raw.trim());
        }
    },
    DECIMAL(Types.DECIMAL) {
        @Override
        Object convert(String raw) {
            return new BigDecimal(raw.trim());
        }
    },
    DATE(Types.DATE) {
        @Override
        Object convert(String raw) {
            return Date.valueOf(DateFormatUtils.parseDate(raw.trim()));
        }
    },
    TIMESTAMP(Types.TIMESTAMP) {
        @Override
        Object convert(String raw) {
            return Timestamp.valueOf(DateFormatUtils.parseDateTime(raw.trim()));
        }
    },
    TEXT(Types.VARCHAR) {
        @Override
        Object convert(String raw) {
            return raw;
        }
    };

    private final int sqlType;

    ColumnType(int sqlType) {
        this.sqlType = sqlType;
    }

    public int getSqlType() {
        return sqlType;
    }

    abstract Object convert(String raw);

    /**
     * @return the JDBC value, or null for a missing or empty field
     * @throws IllegalArgumentException if the field is not a valid value of this type
     */
    public Object parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        if (this != TEXT && raw.isBlank()) {
            return null;
        }
        return convert(raw);
    }
}
