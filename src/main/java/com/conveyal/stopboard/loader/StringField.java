package com.conveyal.stopboard.loader;

import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;

public class StringField extends Field {

    public StringField (String name, Requirement requirement) {
        super(name, requirement);
    }

    @Override
    protected void setTypedParameter (PreparedStatement preparedStatement, int oneBasedIndex, String string)
        throws SQLException {
        preparedStatement.setString(oneBasedIndex, string);
    }

    @Override
    public SQLType getSqlType () {
        return JDBCType.VARCHAR;
    }

}
