package com.libragraph.triage.core.dao;

import com.libragraph.triage.types.JobState;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class JobStateArgumentFactory extends AbstractArgumentFactory<JobState> {

    public JobStateArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(JobState value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
