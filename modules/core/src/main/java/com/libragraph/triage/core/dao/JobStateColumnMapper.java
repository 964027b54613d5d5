package com.libragraph.triage.core.dao;

import com.libragraph.triage.types.JobState;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class JobStateColumnMapper implements ColumnMapper<JobState> {

    @Override
    public JobState map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return JobState.fromId(r.getShort(columnNumber));
    }
}
