package com.aegis.rulegov.service.repository;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Private in-memory H2 databases with the governance schema applied.
 */
final class H2Databases {

    private H2Databases() {
    }

    static DataSource fresh() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:test-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        dataSource.setUser("sa");
        dataSource.setPassword("");

        SchemaInitializer initializer = new SchemaInitializer();
        initializer.dataSource = dataSource;
        initializer.createSchemaIfNotExists();
        return dataSource;
    }
}
