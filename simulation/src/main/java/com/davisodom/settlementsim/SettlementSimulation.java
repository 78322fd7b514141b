package com.davisodom.settlementsim;

import com.davisodom.settlementsim.admin.AdminHttpServer;
import com.davisodom.settlementsim.catalog.YamlStructureCatalog;
import com.davisodom.settlementsim.commands.CommandService;
import com.davisodom.settlementsim.config.SimulationConfig;
import com.davisodom.settlementsim.construction.ConstructionService;
import com.davisodom.settlementsim.construction.SettlementAreaValidator;
import com.davisodom.settlementsim.core.TickEngine;
import com.davisodom.settlementsim.core.TickOrchestrator;
import com.davisodom.settlementsim.disasters.DisasterCoordinator;
import com.davisodom.settlementsim.disasters.DisasterDamageCalculator;
import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.disasters.PassiveRepairService;
import com.davisodom.settlementsim.disasters.RepairCostCalculator;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.economy.ResourceTransfer;
import com.davisodom.settlementsim.economy.TransferService;
import com.davisodom.settlementsim.events.EventDispatcher;
import com.davisodom.settlementsim.events.EventPublisher;
import com.davisodom.settlementsim.events.LoggingEventPublisher;
import com.davisodom.settlementsim.obs.Metrics;
import com.davisodom.settlementsim.persistence.JsonSettlementRepository;
import com.davisodom.settlementsim.persistence.JsonStore;
import com.davisodom.settlementsim.persistence.SettlementRepository;
import com.davisodom.settlementsim.population.HappinessCalculator;
import com.davisodom.settlementsim.population.PopulationEngine;
import com.davisodom.settlementsim.population.StaffingAssigner;
import com.davisodom.settlementsim.production.ProductionCalculator;
import com.davisodom.settlementsim.production.ProductionService;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;
import com.davisodom.settlementsim.settlements.SettlementStats;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Wires the simulation services together and owns their lifecycle.
 *
 * Startup order: config, catalog, ledger and registries, simulation services, persisted state,
 * tick engine, admin server. Shutdown runs in reverse and saves world state last.
 */
public class SettlementSimulation {

    private static final String CATALOG_RESOURCE = "catalog/structures.yml";

    private final Logger logger;
    private final SimulationConfig config;
    private final LongSupplier clock;

    private Metrics metrics;
    private YamlStructureCatalog catalog;
    private ResourceLedger ledger;
    private SettlementService settlementService;
    private ConstructionService constructionService;
    private ProductionService productionService;
    private PopulationEngine populationEngine;
    private DisasterCoordinator disasterCoordinator;
    private TransferService transferService;
    private SettlementRepository repository;
    private EventDispatcher dispatcher;
    private CommandService commandService;
    private TickOrchestrator orchestrator;
    private TickEngine tickEngine;
    private ExecutorService workers;
    private AdminHttpServer adminServer;

    public SettlementSimulation(Logger logger, SimulationConfig config, LongSupplier clock) {
        this.logger = logger;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Build every service and load persisted state. Does not start the tick loop.
     */
    public void initialize(EventPublisher publisher) throws IOException {
        DebugFlags.initialize(config, logger);

        metrics = new Metrics(logger, config.tick.settlementBudgetMicros);
        logger.info("OK Metrics initialized");

        catalog = new YamlStructureCatalog(logger).loadFromClasspath(CATALOG_RESOURCE);
        logger.info("OK Structure catalog loaded " + catalog.allDefinitions().size() + " definition(s)");

        ledger = new ResourceLedger(logger);
        settlementService = new SettlementService(logger, catalog, ledger, config);
        SettlementStats stats = new SettlementStats(catalog);

        constructionService = new ConstructionService(logger, catalog, ledger,
                new SettlementAreaValidator(catalog, config.construction), settlementService, config.construction);
        productionService = new ProductionService(catalog, ledger, new ProductionCalculator(config.production), config);
        populationEngine = new PopulationEngine(logger, config.population, stats,
                new HappinessCalculator(config.population, stats), ledger, new Random());
        disasterCoordinator = new DisasterCoordinator(logger, settlementService, catalog,
                new DisasterDamageCalculator(catalog, stats, config.disasters), new RepairCostCalculator(),
                populationEngine, config.disasters);
        productionService.setModifierSource(disasterCoordinator);
        transferService = new TransferService(logger, settlementService, ledger, config.transfers,
                world -> disasterCoordinator.activeDisaster(world).isPresent());
        logger.info("OK Simulation services initialized");

        if (config.persistence.enabled) {
            JsonStore store = new JsonStore(Paths.get(config.persistence.dataFolder), logger);
            repository = new JsonSettlementRepository(store, logger);
            loadState();
        }

        dispatcher = new EventDispatcher(logger, publisher, metrics);
        commandService = new CommandService(logger, settlementService, ledger, catalog, constructionService,
                productionService, transferService, disasterCoordinator, repository, dispatcher, metrics);

        workers = Executors.newFixedThreadPool(Math.max(1, config.tick.workerThreads), new WorkerThreadFactory());
        orchestrator = new TickOrchestrator(logger, settlementService, ledger, constructionService, productionService,
                populationEngine, new StaffingAssigner(catalog),
                new PassiveRepairService(logger, stats, disasterCoordinator, config.disasters),
                transferService, disasterCoordinator, repository,
                dispatcher, metrics, workers);
        tickEngine = new TickEngine(logger, metrics, config.tick, clock);
        tickEngine.registerSystem("settlements", orchestrator);
        logger.info("OK Tick engine initialized");
    }

    public void start() {
        tickEngine.start();
        if (config.admin.enabled) {
            try {
                adminServer = new AdminHttpServer(logger, config.admin.port, settlementService, ledger,
                        disasterCoordinator, dispatcher, metrics, clock);
                adminServer.start();
            } catch (IOException e) {
                logger.warning("Failed to start admin HTTP server: " + e.getMessage());
            }
        }
        logger.info("Settlement simulation started");
    }

    public void stop() {
        logger.info("Settlement simulation shutting down...");
        if (adminServer != null) {
            adminServer.stop();
        }
        if (tickEngine != null) {
            tickEngine.stop();
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        saveState();
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        logger.info("Settlement simulation stopped");
    }

    private void loadState() throws IOException {
        for (SettlementRepository.StoredSettlement stored : repository.loadSettlements()) {
            SettlementContext context = settlementService.register(stored.settlement());
            ledger.restore(stored.settlement().getId(), stored.balances());
            settlementService.refreshStorageCapacity(context);
            context.markStaffingDirty();
            settlementService.clampPopulation(context);
        }
        for (DisasterEvent event : repository.loadDisasters()) {
            disasterCoordinator.restore(event);
        }
        for (ResourceTransfer transfer : repository.loadTransfers()) {
            transferService.restore(transfer);
        }
        logger.info(String.format("OK Loaded %d settlement(s), %d disaster(s), %d transfer(s) in transit",
                settlementService.size(), disasterCoordinator.getAll().size(), transferService.getInTransit().size()));
    }

    private void saveState() {
        if (repository == null || settlementService == null) {
            return;
        }
        for (SettlementContext context : settlementService.getAll()) {
            context.lock();
            try {
                repository.saveSettlement(context.getSettlement(), ledger.getBalances(context.getSettlement().getId()));
            } catch (IOException e) {
                logger.severe(String.format("Failed to save settlement %s: %s",
                        context.getSettlement().getId(), e.getMessage()));
            } finally {
                context.unlock();
            }
        }
        try {
            repository.saveDisasters(disasterCoordinator.getAll());
            repository.saveTransfers(transferService.getInTransit());
        } catch (IOException e) {
            logger.severe("Failed to save world state: " + e.getMessage());
        }
    }

    public SimulationConfig getConfig() { return config; }
    public Metrics getMetrics() { return metrics; }
    public YamlStructureCatalog getCatalog() { return catalog; }
    public ResourceLedger getLedger() { return ledger; }
    public SettlementService getSettlementService() { return settlementService; }
    public DisasterCoordinator getDisasterCoordinator() { return disasterCoordinator; }
    public TransferService getTransferService() { return transferService; }
    public CommandService getCommandService() { return commandService; }
    public TickOrchestrator getOrchestrator() { return orchestrator; }
    public TickEngine getTickEngine() { return tickEngine; }

    /**
     * Usage: {@code settlement-sim [override.yml]}
     */
    public static void main(String[] args) throws IOException {
        Logger logger = Logger.getLogger("SettlementSim");
        Path override = args.length > 0 ? Paths.get(args[0]) : Paths.get(SimulationConfig.DEFAULT_RESOURCE);
        SimulationConfig config = SimulationConfig.load(override);

        SettlementSimulation simulation = new SettlementSimulation(logger, config, System::currentTimeMillis);
        simulation.initialize(new LoggingEventPublisher(logger));
        Runtime.getRuntime().addShutdownHook(new Thread(simulation::stop, "settlement-sim-shutdown"));
        simulation.start();
    }

    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "settlement-sim-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
