package pfl;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pfl.dal.ConfigurationService;
import pfl.dal.ServerConfig;
import pfl.domain.IntegratedController;
import pfl.domain.StartupException;

/**
 * Main entry point for the PrintFleet ingestion and dispatch service
 * @author Martin Sustik <sustik@herman.cz>
 * @since 24/09/2025
 */
public class PrintFleet {
    private static final Logger logger = LoggerFactory.getLogger(PrintFleet.class);

    public static void main(String[] args) {
        logger.info("Starting PrintFleet...");

        try {
            ConfigurationService configService = new ConfigurationService();
            ServerConfig serverConf = configService.getServerConfiguration();

            logger.info("Configuration loaded successfully");
            logger.debug("Server: {}", serverConf);
            logger.debug("Database: {}", configService.getDatabaseConfiguration());
            logger.debug("Monitor: {}", configService.getMonitorConfiguration());
            logger.debug("Configured printers: {}", configService.getPrinterConfigurations().size());

            Injector injector = Guice.createInjector(new GuiceModule(configService));

            IntegratedController app = new IntegratedController(
                    serverConf,
                    configService.getPrinterConfigurations(),
                    injector
            );

            app.start();

        } catch (StartupException e) {
            logger.error("Application startup failed:");
            logger.error("  Mode: {}", e.getMode());
            logger.error("  Failed services: {}", e.getFailedServices().size());
            for (var result : e.getFailedServices()) {
                logger.error("    - {}", result);
            }
            System.exit(1);

        } catch (Exception e) {
            logger.error("Failed to start application", e);
            System.exit(1);
        }
    }
}
