package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.error.ValueParseException;

import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * A GTFS date in YYYYMMDD form, stored as the integer with the same digits so that ranges compare numerically.
 */
public class DateField extends Field {

    public static final DateTimeFormatter GTFS_DATE_FORMATTER = DateTimeFormatter.BASIC_ISO_DATE;

    public DateField (String name, Requirement requirement) {
        super(name, requirement);
    }

    static int validate (String string) {
        if (string.length() != 8) throw new ValueParseException("Date must be YYYYMMDD", string);
        try {
            LocalDate.parse(string, GTFS_DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new ValueParseException("Not a valid date", string, e);
        }
        return Integer.parseInt(string);
    }

    @Override
    protected void setTypedParameter (PreparedStatement preparedStatement, int oneBasedIndex, String string)
        throws SQLException {
        preparedStatement.setInt(oneBasedIndex, validate(string));
    }

    @Override
    public SQLType getSqlType () {
        return JDBCType.INTEGER;
    }

}
