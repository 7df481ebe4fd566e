package pfl;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import pfl.dal.AlertConfig;
import pfl.dal.ConfigurationService;
import pfl.dal.DatabaseConfig;
import pfl.dal.MonitorConfig;
import pfl.dal.RelayConfig;
import pfl.dal.RepublishConfig;
import pfl.dal.ServerConfig;
import pfl.dal.db.ScheduledJobRepository;
import pfl.domain.alert.AlertDispatcher;
import pfl.domain.alert.AlertEventSubscriber;
import pfl.domain.alert.INotificationChannel;
import pfl.domain.alert.WebhookChannel;
import pfl.domain.consumer.ArchiveWriter;
import pfl.domain.consumer.CareCounterUpdater;
import pfl.domain.consumer.EventRelayWriter;
import pfl.domain.consumer.MqttRepublisher;
import pfl.domain.event.IEventBus;
import pfl.domain.event.IEventConsumer;
import pfl.domain.event.InMemoryEventBus;
import pfl.domain.lifecycle.IScheduleProvider;
import pfl.domain.lifecycle.PrintStoppingErrorCatalog;
import pfl.domain.printer.IPrinterAdapterFactory;
import pfl.domain.printer.PrinterAdapterFactory;

import javax.inject.Named;
import javax.inject.Singleton;
import javax.sql.DataSource;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * @author Martin Sustik <sustik@herman.cz>
 * @since 07/11/2025
 */
public class GuiceModule extends AbstractModule {
    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        bind(ConfigurationService.class).toInstance(configService);
        bind(ServerConfig.class).toInstance(configService.getServerConfiguration());
        bind(DatabaseConfig.class).toInstance(configService.getDatabaseConfiguration());
        bind(MonitorConfig.class).toInstance(configService.getMonitorConfiguration());
        bind(AlertConfig.class).toInstance(configService.getAlertConfiguration());
        bind(RelayConfig.class).toInstance(configService.getRelayConfiguration());
        bind(RepublishConfig.class).toInstance(configService.getRepublishConfiguration());

        bind(IEventBus.class).to(InMemoryEventBus.class).in(Singleton.class);
        bind(IScheduleProvider.class).to(ScheduledJobRepository.class);
        bind(IPrinterAdapterFactory.class).to(PrinterAdapterFactory.class);

        //********************************
        //******** Notifications *********
        //********************************
        // email and push senders plug in here
        Multibinder<INotificationChannel> channels = Multibinder.newSetBinder(binder(), INotificationChannel.class);
        channels.addBinding().to(WebhookChannel.class);

        //********************************
        //******** Bus consumers *********
        //********************************
        Multibinder<IEventConsumer> consumers = Multibinder.newSetBinder(binder(), IEventConsumer.class);
        consumers.addBinding().to(EventRelayWriter.class);
        consumers.addBinding().to(AlertEventSubscriber.class);
        consumers.addBinding().to(ArchiveWriter.class);
        consumers.addBinding().to(CareCounterUpdater.class);
        consumers.addBinding().to(MqttRepublisher.class);
    }

    @Provides
    @Singleton
    public HikariDataSource provideHikariDataSource(DatabaseConfig databaseConfig) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(databaseConfig.url());
        config.setUsername(databaseConfig.username());
        config.setPassword(databaseConfig.password());
        config.setMaximumPoolSize(databaseConfig.poolSize());
        config.setPoolName("printfleet-db");
        return new HikariDataSource(config);
    }

    @Provides
    public DataSource provideDataSource(HikariDataSource dataSource) {
        return dataSource;
    }

    @Provides
    @Singleton
    public HttpClient provideHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Runs the discovery and health sweeps
     */
    @Provides
    @Singleton
    public ScheduledExecutorService provideScheduler(ServerConfig serverConfig) {
        return Executors.newScheduledThreadPool(serverConfig.threadPoolSize(),
                new ThreadFactoryBuilder().setNameFormat("fleet-sweep-%d").setDaemon(true).build());
    }

    /**
     * Poll loops and socket readers, one or two threads per connected printer
     */
    @Provides
    @Singleton
    @Named(PrinterAdapterFactory.WORKER_POOL)
    public ExecutorService provideAdapterWorkers() {
        return Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("printer-worker-%d").setDaemon(true).build());
    }

    @Provides
    @Singleton
    @Named(AlertDispatcher.DELIVERY_POOL)
    public ExecutorService provideDeliveryPool(AlertConfig alertConfig) {
        return Executors.newFixedThreadPool(alertConfig.deliveryThreads(),
                new ThreadFactoryBuilder().setNameFormat("alert-delivery-%d").setDaemon(true).build());
    }

    @Provides
    @Singleton
    public PrintStoppingErrorCatalog providePrintStoppingErrors() {
        return PrintStoppingErrorCatalog.load(configService.getStoppingErrorsFile());
    }
}
