package com.attribute.resolution.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 database holding a small pooled SEND data set.
 *
 * <pre>
 * S1  A1, A2 EXROUTE ORAL; A3, A4 dosed ORAL as pool P1; A5 no EX row; TS ROUTE ORAL, SDESIGN PARALLEL
 * S2  B1 SUBCUTANEOUS, B2 ORAL; TS ROUTE SUBCUTANEOUS and ORAL, SDESIGN PARALLEL and CROSSOVER
 * S3  C1 ORAL and INTRAVENOUS, C2 no EX row; no TS ROUTE, SDESIGN LATIN SQUARE (not in CT)
 * </pre>
 */
public final class SendTestDatabase {

    public static final String USER = "sa";
    public static final String PASSWORD = "";

    private final String url;

    private SendTestDatabase(String url) {
        this.url = url;
    }

    /**
     * Creates a fresh database; it lives until the JVM exits.
     */
    public static SendTestDatabase create() throws SQLException {
        SendTestDatabase database = new SendTestDatabase(
                "jdbc:h2:mem:send-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        database.execute(
                "create table TS (STUDYID varchar(20), TSPARMCD varchar(8), TSVAL varchar(200))",
                "create table EX (STUDYID varchar(20), USUBJID varchar(40), POOLID varchar(20), EXROUTE varchar(40))",
                "create table POOLDEF (STUDYID varchar(20), USUBJID varchar(40), POOLID varchar(20))",
                "create table CDISC_CT (CODELIST varchar(20), SUBMISSION_VALUE varchar(200))",

                "insert into TS values ('S1', 'ROUTE', 'ORAL'), ('S1', 'SDESIGN', 'PARALLEL'),"
                        + " ('S1', 'SPECIES', 'RAT'),"
                        + " ('S2', 'ROUTE', 'SUBCUTANEOUS'), ('S2', 'ROUTE', 'ORAL'),"
                        + " ('S2', 'SDESIGN', 'PARALLEL'), ('S2', 'SDESIGN', 'CROSSOVER'),"
                        + " ('S3', 'ROUTE', ''), ('S3', 'SDESIGN', 'LATIN SQUARE')",

                "insert into EX values ('S1', 'A1', null, 'ORAL'), ('S1', 'A1', null, 'oral'),"
                        + " ('S1', 'A2', null, 'ORAL'), ('S1', null, 'P1', 'ORAL'),"
                        + " ('S2', 'B1', null, 'SUBCUTANEOUS'), ('S2', 'B2', null, 'ORAL'),"
                        + " ('S3', 'C1', null, 'ORAL'), ('S3', 'C1', null, 'INTRAVENOUS')",

                "insert into POOLDEF values ('S1', 'A3', 'P1'), ('S1', 'A4', 'P1')",

                "insert into CDISC_CT values ('ROUTE', 'ORAL'), ('ROUTE', 'SUBCUTANEOUS'),"
                        + " ('ROUTE', 'INTRAVENOUS'), ('DESIGN', 'PARALLEL'), ('DESIGN', 'CROSSOVER')"
        );
        return database;
    }

    public String getUrl() {
        return url;
    }

    public void execute(String... statements) throws SQLException {
        try (Connection connection = DriverManager.getConnection(url, USER, PASSWORD);
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }
}
