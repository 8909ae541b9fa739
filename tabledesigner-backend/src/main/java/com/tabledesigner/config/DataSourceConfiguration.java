package com.tabledesigner.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wires settings and the two SQLite pools: one for the live tables, one for design records.
 */
@Slf4j
@Configuration
public class DataSourceConfiguration {

    @Bean
    public DesignerSettings designerSettings(Environment environment) {
        DesignerSettings settings = DesignerSettings.fromEnvironment(environment);
        log.info("Table designer settings: database={}, design_store={}, mode={}, preserve_rows={}",
                settings.databasePath(), settings.designStorePath(), settings.alterationMode(), settings.preserveRows());
        return settings;
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource schemaDataSource(DesignerSettings settings) {
        return SqliteDataSources.create(settings.databasePath(), "Pool-schema", settings);
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource designDataSource(DesignerSettings settings) {
        return SqliteDataSources.create(settings.designStorePath(), "Pool-design", settings);
    }
}
