package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.error.ValueParseException;

import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;

public class IntegerField extends Field {

    private final int minValue;

    private final int maxValue;

    public IntegerField(String name, Requirement required) {
        this(name, required, 0, Integer.MAX_VALUE);
    }

    public IntegerField(String name, Requirement requirement, int maxValue) {
        this(name, requirement, 0, maxValue);
    }

    public IntegerField(String name, Requirement requirement, int minValue, int maxValue) {
        super(name, requirement);
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    int validate (String string) {
        int value;
        try {
            value = Integer.parseInt(string);
        } catch (NumberFormatException e) {
            throw new ValueParseException("Not an integer for " + name, string, e);
        }
        if (value < minValue) throw new ValueParseException("Number too small for " + name, string);
        if (value > maxValue) throw new ValueParseException("Number too large for " + name, string);
        return value;
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
