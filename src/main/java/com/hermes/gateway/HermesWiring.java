package com.hermes.gateway;

import com.hermes.containers.ClaimSweeper;
import com.hermes.containers.ContainerClaimCoordinator;
import com.hermes.containers.ContainerRecord;
import com.hermes.containers.DockerContainerLauncher;
import com.hermes.containers.WarmPool;
import com.hermes.observability.DoctorCommand;
import com.hermes.observability.HermesMetrics;
import com.hermes.pipeline.InboundMessageProcessor;
import com.hermes.pipeline.SenderDirectory;
import com.hermes.queues.InMemoryQueueTransport;
import com.hermes.queues.PostgresQueueTransport;
import com.hermes.queues.QueueTopologyManager;
import com.hermes.queues.QueueTransport;
import com.hermes.routing.CommandRecord;
import com.hermes.routing.MessageEnvelopeRouter;
import com.hermes.routing.ResponseCorrelator;
import com.hermes.sessions.SessionRegistry;
import com.hermes.shared.config.ConfigLoader;
import com.hermes.shared.config.HermesConfig;
import com.hermes.shared.model.ContainerClaim;
import com.hermes.shared.model.QueuePair;
import com.hermes.shared.model.Session;
import com.hermes.store.InMemoryVersionedStore;
import com.hermes.store.PostgresVersionedStore;
import com.hermes.store.VersionedStore;
import com.hermes.threads.ThreadIdResolver;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class HermesWiring {

    private static final Logger log = LoggerFactory.getLogger(HermesWiring.class);

    private final HermesConfig config = ConfigLoader.load();
    private final DataSource dataSource = config.usePostgres() ? openDataSource(config) : null;

    @Bean
    public HermesConfig hermesConfig() {
        return config;
    }

    @Bean
    public WebServerFactoryCustomizer<ConfigurableWebServerFactory> serverPort() {
        return factory -> factory.setPort(config.serverPort());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HermesMetrics hermesMetrics() {
        return new HermesMetrics();
    }

    @Bean
    public QueueTransport queueTransport(Clock clock) {
        return dataSource != null ? new PostgresQueueTransport(dataSource) : new InMemoryQueueTransport(clock);
    }

    @Bean
    public WarmPool warmPool(Clock clock) {
        var launcher = "docker".equalsIgnoreCase(config.containers().launcher())
                ? new DockerContainerLauncher(config.containers())
                : null;
        return new WarmPool(store("containers", ContainerRecord.class), launcher, clock);
    }

    @Bean
    public ContainerClaimCoordinator claimCoordinator(WarmPool pool, HermesMetrics metrics, Clock clock) {
        return new ContainerClaimCoordinator(store("claims", ContainerClaim.class), pool, config.claims(), metrics, clock);
    }

    @Bean(destroyMethod = "close")
    public ClaimSweeper claimSweeper(ContainerClaimCoordinator coordinator, WarmPool pool) {
        var sweeper = new ClaimSweeper(coordinator, pool, config.claims(), config.containers().warmPoolSize());
        sweeper.start();
        return sweeper;
    }

    @Bean
    public QueueTopologyManager queueTopologyManager(QueueTransport transport, ContainerClaimCoordinator claims,
                                                     Clock clock) {
        return new QueueTopologyManager(transport, store("queues", QueuePair.class), claims,
                config.queues().prefix(), clock);
    }

    @Bean
    public SessionRegistry sessionRegistry(HermesMetrics metrics, Clock clock) {
        return new SessionRegistry(store("sessions", Session.class), metrics, clock);
    }

    @Bean
    public VersionedStore<CommandRecord> commandStore() {
        return store("commands", CommandRecord.class);
    }

    @Bean
    public MessageEnvelopeRouter messageEnvelopeRouter(QueueTransport transport, VersionedStore<CommandRecord> commands,
                                                       HermesMetrics metrics, Clock clock) {
        return new MessageEnvelopeRouter(transport, commands, metrics, clock);
    }

    @Bean
    public ResponseCorrelator responseCorrelator(QueueTransport transport, VersionedStore<CommandRecord> commands,
                                                 ContainerClaimCoordinator claims, HermesMetrics metrics) {
        return new ResponseCorrelator(transport, commands, claims, metrics,
                Duration.ofSeconds(config.queues().visibilityTimeoutSeconds()), config.queues().responseBatchSize());
    }

    @Bean
    public InboundMessageProcessor inboundMessageProcessor(SessionRegistry sessions, QueueTopologyManager queues,
                                                           ContainerClaimCoordinator claims,
                                                           MessageEnvelopeRouter router) {
        return new InboundMessageProcessor(new ThreadIdResolver(), sessions, queues, claims, router,
                new SenderDirectory(config.routing()));
    }

    @Bean
    public DoctorCommand doctorCommand(WarmPool pool) {
        return new DoctorCommand(dataSource, pool);
    }

    private <T> VersionedStore<T> store(String namespace, Class<T> type) {
        return dataSource != null
                ? new PostgresVersionedStore<>(dataSource, namespace, type)
                : new InMemoryVersionedStore<>();
    }

    private static DataSource openDataSource(HermesConfig config) {
        var ds = new HikariDataSource();
        ds.setJdbcUrl(config.database().get("url"));
        ds.setUsername(config.database().get("username"));
        ds.setPassword(config.database().get("password"));
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(ds);
        log.info("Using PostgreSQL store at {}", config.database().get("url"));
        return ds;
    }
}
