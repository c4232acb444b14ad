package io.clubone.outreach;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@Configuration
public class CrmDataSourceConfig {

  @Bean
  @Primary
  @ConfigurationProperties("spring.datasource.crm")
  public DataSourceProperties crmDataSourceProperties() {
    return new DataSourceProperties();
  }

  @Bean(name = "crmDataSource")
  @Primary
  public DataSource crmDataSource(@Qualifier("crmDataSourceProperties") DataSourceProperties props) {
    return props.initializeDataSourceBuilder().build();
  }

  @Bean(name = "crmJdbcTemplate")
  @Primary
  public JdbcTemplate crmJdbcTemplate(@Qualifier("crmDataSource") DataSource ds) {
    return new JdbcTemplate(ds);
  }
}
