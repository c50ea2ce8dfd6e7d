package com.pagetree.repository;

import java.sql.ResultSet;
import java.sql.SQLDataException;
import java.sql.SQLException;

/**
 * Positional column readers shared by the row mappers.
 */
final class Columns {

    private Columns() {
    }

    static int requiredInt(ResultSet rs, int column) throws SQLException {
        int value = rs.getInt(column);
        if (rs.wasNull()) {
            throw new SQLDataException("NULL in column " + column + " of row " + rs.getRow());
        }
        return value;
    }

    static String requiredString(ResultSet rs, int column) throws SQLException {
        String value = rs.getString(column);
        if (value == null) {
            throw new SQLDataException("NULL in column " + column + " of row " + rs.getRow());
        }
        return value;
    }

    static String optionalString(ResultSet rs, int column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? value : "";
    }
}
