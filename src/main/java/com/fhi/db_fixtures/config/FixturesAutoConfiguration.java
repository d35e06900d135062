package com.fhi.db_fixtures.config;

import javax.sql.DataSource;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.orm.jpa.SharedEntityManagerCreator;

import com.fhi.db_fixtures.lifecycle.FixtureLifecycleManager;
import com.fhi.db_fixtures.lifecycle.FixtureSession;
import com.fhi.db_fixtures.loader.FixtureLoader;
import com.fhi.db_fixtures.materialize.ModelRegistry;
import com.fhi.db_fixtures.materialize.RecordMaterializer;
import com.fhi.db_fixtures.materialize.SchemaContext;
import com.fhi.db_fixtures.parser.FixtureParser;
import com.fhi.db_fixtures.resolve.FixtureFileResolver;

import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;


/**
 * Creates the fixture engine once the application has a JPA persistence unit.
 *
 * <p>Every bean backs off when the application defines its own, so e.g. a {@link ModelRegistry}
 * with extra model names can be provided by a test configuration.</p>
 */
@Slf4j
@AutoConfiguration(after = HibernateJpaAutoConfiguration.class)
@ConditionalOnClass(EntityManagerFactory.class)
@ConditionalOnBean({ EntityManagerFactory.class, DataSource.class })
@ConditionalOnProperty(prefix = "fixtures", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FixturesProperties.class)
public class FixturesAutoConfiguration
{
    @Bean
    @ConditionalOnMissingBean
    public ModelRegistry fixtureModelRegistry(EntityManagerFactory entityManagerFactory)
    {   return ModelRegistry.fromMetamodel(entityManagerFactory.getMetamodel());
    }


    @Bean
    @ConditionalOnMissingBean
    public SchemaContext fixtureSchemaContext(EntityManagerFactory entityManagerFactory, DataSource dataSource,
                                              ModelRegistry modelRegistry)
    {   // Shared proxy: resolves to the EntityManager of the current transaction.
        return new SchemaContext(SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory),
                                 new JdbcTemplate(dataSource),
                                 modelRegistry);
    }


    @Bean
    @ConditionalOnMissingBean
    public FixtureSession fixtureSession(EntityManagerFactory entityManagerFactory, DataSource dataSource,
                                        SchemaContext schemaContext)
    {   return new FixtureSession(entityManagerFactory, dataSource, schemaContext);
    }


    @Bean
    @ConditionalOnMissingBean
    public FixtureLoader fixtureLoader(FixturesProperties properties)
    {   return new FixtureLoader(new FixtureFileResolver(), new FixtureParser(), new RecordMaterializer(),
                                 properties.searchDirs());
    }


    @Bean
    @ConditionalOnMissingBean
    public FixtureLifecycleManager fixtureLifecycleManager(FixtureSession session, FixtureLoader loader,
                                                           FixturesProperties properties)
    {   log.info("Fixture engine ready: isolation {}, fixture directories {}", properties.getIsolation(),
                 loader.getSearchDirs());
        return new FixtureLifecycleManager(session, loader, properties.getIsolation());
    }
}
