package com.statgrid.service.core.support;

import java.sql.SQLException;

/** Walks an exception chain looking for a Postgres SQLState. */
public final class SqlStates {

    public static final String DEADLOCK = "40P01";
    public static final String CHECK_VIOLATION = "23514";

    private SqlStates() {}

    public static boolean hasState(Throwable ex, String state) {
        return findSqlException(ex, state) != null;
    }

    public static SQLException findSqlException(Throwable ex, String state) {
        Throwable cause = ex;
        while (cause != null) {
            if (cause instanceof SQLException sqlEx && state.equals(sqlEx.getSQLState())) {
                return sqlEx;
            }
            cause = cause.getCause();
        }
        return null;
    }
}
