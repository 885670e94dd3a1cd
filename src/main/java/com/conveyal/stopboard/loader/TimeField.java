package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.util.GtfsTime;

import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;

/**
 * A field in the format HH:MM:SS. Unlike seconds-after-midnight storage, the raw string is kept so that times past
 * 24:00:00 survive verbatim; it is only checked for being a well formed GTFS time.
 */
public class TimeField extends Field {

    public TimeField(String name, Requirement requirement) {
        super(name, requirement);
    }

    @Override
    protected void setTypedParameter (PreparedStatement preparedStatement, int oneBasedIndex, String hhmmss)
        throws SQLException {
        // Throws on malformed input, the value itself is not needed.
        GtfsTime.timeToSeconds(hhmmss);
        preparedStatement.setString(oneBasedIndex, hhmmss);
    }

    @Override
    public SQLType getSqlType () {
        return JDBCType.VARCHAR;
    }

}
