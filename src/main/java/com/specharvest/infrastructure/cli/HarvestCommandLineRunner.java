package com.specharvest.infrastructure.cli;

import com.specharvest.application.usecase.HarvestOptions;
import com.specharvest.application.usecase.HarvestPhonesUseCase;
import com.specharvest.application.usecase.HarvestPhonesUseCase.HarvestSummary;
import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.model.SpecComparison;
import com.specharvest.domain.ports.CatalogGateway;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.ports.PhoneRepository;
import com.specharvest.domain.service.SpecificationReport;
import com.specharvest.domain.support.CancellationToken;
import com.specharvest.infrastructure.config.HarvestProperties;
import com.specharvest.infrastructure.output.JsonSnapshotWriter;
import com.specharvest.infrastructure.scraper.gsmarena.GsmArenaSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point for the harvest, brands, listing and spec commands.
 */
@Component
public class HarvestCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(HarvestCommandLineRunner.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private final HarvestPhonesUseCase harvestPhonesUseCase;
    private final CatalogGateway catalog;
    private final PhoneRepository repository;
    private final GsmArenaSite site;
    private final JsonSnapshotWriter snapshotWriter;
    private final CancellationToken cancellation;
    private final HarvestProperties properties;

    private int exitCode;

    public HarvestCommandLineRunner(HarvestPhonesUseCase harvestPhonesUseCase,
                                    CatalogGateway catalog,
                                    PhoneRepository repository,
                                    GsmArenaSite site,
                                    JsonSnapshotWriter snapshotWriter,
                                    CancellationToken cancellation,
                                    HarvestProperties properties) {
        this.harvestPhonesUseCase = harvestPhonesUseCase;
        this.catalog = catalog;
        this.repository = repository;
        this.site = site;
        this.snapshotWriter = snapshotWriter;
        this.cancellation = cancellation;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        HarvestArguments arguments = HarvestArguments.parse(args);
        GracefulShutdown shutdown = new GracefulShutdown(cancellation, SHUTDOWN_GRACE);
        shutdown.register();

        try {
            switch (arguments.command()) {
                case HARVEST -> harvest(arguments);
                case BRANDS -> output(catalog.fetchBrands(), arguments);
                case LISTING -> output(catalog.fetchListing(arguments.text(0), arguments.number(1)), arguments);
                case SPEC -> spec(arguments);
                case COMPARE -> compare(arguments);
            }
        } catch (FetchException e) {
            logger.error("{} failed: {}", arguments.command(), e.getMessage());
            exitCode = 1;
        } finally {
            shutdown.finished();
        }
    }

    private void harvest(HarvestArguments arguments) throws FetchException {
        HarvestOptions options = new HarvestOptions(
            arguments.number(0) != null ? arguments.number(0) : properties.getMaxBrands(),
            arguments.number(1) != null ? arguments.number(1) : properties.getMaxItemsPerBrand(),
            properties.isSkipExisting(),
            Math.max(1, properties.getParallelism()),
            properties.getItemDelay(),
            properties.getBrandDelay());

        logger.info("Configuration: channel={}, records={}, listing={}, maxBrands={}, maxItemsPerBrand={}, "
                + "skipExisting={}, parallelism={}, itemDelay={}ms, brandDelay={}ms",
            properties.getChannel(),
            properties.getCollections().getRecords(),
            properties.getCollections().getListing(),
            options.maxBrands() == null ? "all" : options.maxBrands(),
            options.maxItemsPerBrand() == null ? "all" : options.maxItemsPerBrand(),
            options.skipExisting(),
            options.parallelism(),
            options.itemDelay().toMillis(),
            options.brandDelay().toMillis());

        repository.initialize();
        long initialCount = repository.countRecords();
        logger.info("Records before run: {}", initialCount);

        HarvestSummary summary = harvestPhonesUseCase.execute(options);

        long finalCount = repository.countRecords();
        logger.info("Brands processed: {}, failed: {}", summary.brandsProcessed(), summary.brandsFailed());
        logger.info("Items found: {}, stored: {}, skipped: {}, failed: {}",
            summary.itemsFound(), summary.itemsStored(), summary.itemsSkipped(), summary.itemsFailed());
        logger.info("Records after run: {} ({} new)", finalCount, finalCount - initialCount);
        if (summary.aborted()) {
            logger.error("Run aborted early: {}", summary.abortReason());
        }
        if (summary.cancelled()) {
            logger.warn("Run cancelled, statistics are partial");
        }
    }

    private void spec(HarvestArguments arguments) throws IOException {
        List<ListingItem> items = arguments.positionals().stream().map(this::detailItem).toList();
        List<PhoneRecord> records = harvestPhonesUseCase.lookupAll(items, null);
        if (records.isEmpty()) {
            logger.error("None of the {} requested devices could be fetched", items.size());
            exitCode = 1;
            return;
        }

        if (arguments.format() == HarvestArguments.Format.TEXT) {
            outputText(records.stream().map(SpecificationReport::format).collect(Collectors.joining("\n")), arguments);
        } else {
            output(items.size() == 1 ? records.get(0) : records, arguments);
        }
    }

    private void compare(HarvestArguments arguments) throws IOException {
        PhoneRecord left = harvestPhonesUseCase.lookup(detailItem(arguments.text(0)), null);
        PhoneRecord right = harvestPhonesUseCase.lookup(detailItem(arguments.text(1)), null);
        SpecComparison comparison = SpecificationReport.compare(left, right);

        if (arguments.format() == HarvestArguments.Format.TEXT) {
            outputText(SpecificationReport.format(comparison), arguments);
        } else {
            output(comparison, arguments);
        }
    }

    private ListingItem detailItem(String detailId) {
        return new ListingItem(detailId, detailId, site.detailUrl(detailId), null);
    }

    private void outputText(String text, HarvestArguments arguments) throws IOException {
        if (arguments.outputFile() != null) {
            Path target = Path.of(arguments.outputFile());
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, text, StandardCharsets.UTF_8);
            logger.info("Wrote report to {}", target);
        } else {
            System.out.print(text);
            System.out.flush();
        }
    }

    private void output(Object value, HarvestArguments arguments) throws IOException {
        if (arguments.outputFile() != null) {
            snapshotWriter.write(value, Path.of(arguments.outputFile()));
        } else {
            snapshotWriter.write(value, System.out);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
