package io.telemetry.insights.pipeline.clients_daily_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    @Autowired
    private Environment env;

    @Primary
    @Bean(name = "appDataSource")
    public DataSource appDataSource() {
        return pool("app");
    }

    @Bean(name = "batchDataSource")
    public DataSource batchDataSource() {
        return pool("batch");
    }

    @Bean(name = "appTransactionManager")
    public DataSourceTransactionManager appTransactionManager(@Qualifier("appDataSource") DataSource appDataSource) {
        return new DataSourceTransactionManager(appDataSource);
    }

    @Bean(name = {"batchTransactionManager", "transactionManager"})
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    private HikariDataSource pool(String name) {
        String prefix = "spring.datasource." + name + ".";
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(name + "-pool");
        dataSource.setDriverClassName(env.getProperty(prefix + "driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty(prefix + "url"));
        dataSource.setUsername(env.getProperty(prefix + "username"));
        dataSource.setPassword(env.getProperty(prefix + "password"));
        dataSource.setMaximumPoolSize(env.getProperty(prefix + "maximum-pool-size", Integer.class, 4));
        return dataSource;
    }

}
