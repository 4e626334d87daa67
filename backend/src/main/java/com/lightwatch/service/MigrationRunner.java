package com.lightwatch.service;

import com.lightwatch.dao.DbClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

@Component
@Root
public final class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);
    private static final String[] FALLBACK_SCRIPTS = {"/db/migration/V1__init.sql"};

    public MigrationRunner(DbClient dbClient) {
        var flyway = Flyway.configure()
            .dataSource(dbClient.dataSource())
            .locations("classpath:db/migration")
            .load();

        int executed = 0;
        try {
            executed = flyway.migrate().migrationsExecuted;
        } catch (Exception e) {
            logger.warn("Flyway migration failed, falling back to plain SQL scripts: {}", e.getMessage());
        }
        logger.info("Flyway migrations executed: {}", executed);

        if (!tableExists(dbClient, "devices") || !tableExists(dbClient, "power_history")) {
            logger.warn("Schema incomplete after Flyway, applying SQL scripts");
            for (String script : FALLBACK_SCRIPTS) {
                runSqlScript(dbClient, script);
            }
        }
    }

    static boolean tableExists(DbClient dbClient, String tableName) {
        try (Connection connection = dbClient.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            for (String candidate : new String[]{tableName.toLowerCase(Locale.ROOT), tableName.toUpperCase(Locale.ROOT)}) {
                try (ResultSet rs = meta.getTables(null, null, candidate, new String[]{"TABLE"})) {
                    if (rs.next()) {
                        return true;
                    }
                }
            }
            return false;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot verify migration table existence", e);
        }
    }

    private static void runSqlScript(DbClient dbClient, String resourcePath) {
        String script;
        try (var in = MigrationRunner.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Missing migration script: " + resourcePath);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read migration script: " + resourcePath, e);
        }

        String cleaned = script.replaceAll("(?m)^\\s*--.*$", "");
        try (Connection connection = dbClient.beginTransaction();
             Statement st = connection.createStatement()) {
            for (String raw : cleaned.split(";")) {
                String sql = raw.trim();
                if (!sql.isEmpty()) {
                    st.execute(sql);
                }
            }
            connection.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot execute fallback migration " + resourcePath, e);
        }
    }
}
