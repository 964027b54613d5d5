package com.libragraph.triage.core.dao;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.sqlobject.SqlObject;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;

public interface DatabaseDao extends SqlObject {

    @SqlQuery("SELECT 1")
    int ping();

    /** Product name and version as reported by the JDBC driver. */
    default String productVersion() {
        Handle handle = getHandle();
        try {
            DatabaseMetaData meta = handle.getConnection().getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read database metadata", e);
        }
    }
}
