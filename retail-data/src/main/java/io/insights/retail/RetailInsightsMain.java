package io.insights.retail;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.insights.metrics.Metrics;
import io.insights.source.ListSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI: validate the sales, inventory and review CSVs and print the business summary.
 */
@CommandLine.Command(name = "retail-insights", mixinStandardHelpOptions = true,
        description = "Validate retail CSV datasets and summarize revenue, stock and reviews")
public final class RetailInsightsMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RetailInsightsMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_REJECTED = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-s", "--sales"}, description = "Sales CSV (Date,Product,Quantity,Amount,...)")
    Path salesFile;

    @CommandLine.Option(names = {"-i", "--inventory"}, description = "Inventory CSV (Product,Stock,Price,...)")
    Path inventoryFile;

    @CommandLine.Option(names = {"-r", "--reviews"}, description = "Reviews CSV (Date,Rating,Review,Product,...)")
    Path reviewsFile;

    @CommandLine.Option(names = {"-d", "--data-dir"}, description = "Directory holding sales.csv, inventory.csv and reviews.csv")
    Path dataDir;

    @CommandLine.Option(names = "--demo", description = "Summarize generated demo data instead of files")
    boolean demo;

    @CommandLine.Option(names = "--seed", description = "Seed for --demo", defaultValue = "42")
    long seed;

    @CommandLine.Option(names = {"-l", "--low-stock-limit"}, description = "Max low-stock items to report (default: insights.lowStockLimit, else 10 for files and 5 for --demo)")
    Integer lowStockLimit;

    @CommandLine.Option(names = "--whole-words", description = "Match sentiment words as whole words only")
    boolean wholeWords;

    @CommandLine.Option(names = {"-j", "--json"}, description = "Also write the summary bundle as JSON to this file")
    Path jsonOut;

    @CommandLine.Option(names = "--sample", description = "Records per dataset in the JSON context sample (default: insights.sampleSize or 10)")
    Integer sampleSize;

    @CommandLine.Option(names = "--metrics", description = "Print ingest counters to stderr when done")
    boolean printMetrics;

    public static void main(String[] args) {
        int code = new CommandLine(new RetailInsightsMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (lowStockLimit != null && lowStockLimit < 0) {
            err.println("--low-stock-limit must be >= 0");
            return EXIT_REJECTED;
        }
        if (sampleSize != null && sampleSize < 0) {
            err.println("--sample must be >= 0");
            return EXIT_REJECTED;
        }

        RetailConfig cfg = RetailConfig.fromEnv();
        if (lowStockLimit != null) cfg = cfg.withLowStockLimit(lowStockLimit);
        if (wholeWords) cfg = cfg.withWholeWordSentiment(true);
        if (sampleSize != null) cfg = cfg.withSampleSize(sampleSize);

        Injector injector = Guice.createInjector(new RetailInsightsModule(cfg));
        BusinessInsightsService service = injector.getInstance(BusinessInsightsService.class);

        InsightsBundle bundle;
        if (demo) {
            bundle = service.demo(new DemoDataGenerator(seed));
        } else {
            Map<DatasetKind, Path> files = inputFiles();
            if (files.size() < DatasetKind.values().length) {
                err.println("Provide --sales, --inventory and --reviews, or --data-dir, or --demo");
                return EXIT_REJECTED;
            }
            List<RawDataset> inputs = new ArrayList<>();
            try {
                for (Map.Entry<DatasetKind, Path> e : files.entrySet()) {
                    inputs.add(RawDataset.read(e.getKey(), e.getValue()));
                }
            } catch (IOException e) {
                err.println("Cannot read input: " + e.getMessage());
                return EXIT_FAILED;
            }

            AnalysisOutcome outcome;
            try {
                outcome = service.analyze(new ListSource<>(inputs, RawDataset::name), cfg.uploadLowStockLimit());
            } catch (DecodeException e) {
                err.println("Failed to parse CSV file: " + e.getMessage());
                return EXIT_FAILED;
            }
            if (!outcome.isComplete()) {
                err.print(SummaryFormatter.formatRejections(outcome.validations()));
                err.flush();
                return EXIT_REJECTED;
            }
            bundle = outcome.bundle();
        }

        out.print(SummaryFormatter.format(bundle));
        out.flush();

        if (jsonOut != null) {
            try {
                injector.getInstance(SummaryJsonWriter.class).write(bundle, jsonOut);
                out.println("Wrote " + jsonOut);
            } catch (IOException e) {
                log.error("writing {} failed", jsonOut, e);
                err.println("Cannot write " + jsonOut + ": " + e.getMessage());
                return EXIT_FAILED;
            }
        }

        if (printMetrics) {
            injector.getInstance(Metrics.class).counts().forEach((k, v) -> err.println(k + "=" + v));
            err.flush();
        }
        return EXIT_OK;
    }

    // explicit file options win over the data directory
    private Map<DatasetKind, Path> inputFiles() {
        Map<DatasetKind, Path> files = new EnumMap<>(DatasetKind.class);
        for (DatasetKind kind : DatasetKind.values()) {
            Path explicit = switch (kind) {
                case SALES -> salesFile;
                case INVENTORY -> inventoryFile;
                case REVIEWS -> reviewsFile;
            };
            if (explicit != null) {
                files.put(kind, explicit);
            } else if (dataDir != null) {
                files.put(kind, dataDir.resolve(kind.fileName()));
            }
        }
        return files;
    }
}
