package com.seedforge.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.seedforge.app.logging.LogSetup;
import com.seedforge.core.api.IUrlCatalog;
import com.seedforge.core.catalog.FileUrlSource;
import com.seedforge.core.catalog.FilteringUrlCatalog;
import com.seedforge.core.error.SeedForgeException;
import com.seedforge.core.http.HttpHostProbe;
import com.seedforge.core.model.OutputFormat;
import com.seedforge.core.model.SeedConfig;
import com.seedforge.core.precheck.PrecheckExemptions;
import com.seedforge.core.precheck.Prechecker;
import com.seedforge.core.service.SeedService;
import com.seedforge.core.service.importer.ImportSummary;
import com.seedforge.core.service.importer.JsonLinesJobImporter;
import com.seedforge.core.service.importer.PrecheckImportService;
import com.seedforge.core.util.YamlConfigLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 커맨드라인 진입점.
 *   seeds            --format text|browsertrix --pattern P --workers 4 [--precheck-connections]
 *   multi-seeds      --format text|browsertrix --pattern P --workers 2 --size 1000
 *                    --single-group-size 0 --output DIR [--precheck-connections]
 *   import-precheck  --log FILE --output FILE.jsonl [--dry-run]
 * 공통: --urls FILE, --config FILE, --exemptions FILE
 */
public final class App {
    private static final Logger LOG = Logger.getLogger(App.class.getName());

    static final String DEFAULT_URLS_FILE = "urls.txt";

    private final PrintStream out;
    private final PrintStream err;

    App(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        // 로그 초기화 (-Dsf.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("sf.out.dir", "out"));
        LogSetup.configure(outRoot);

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.log(Level.SEVERE, "\n==== Uncaught: " + t.getName() + " ====", e));

        System.exit(new App(System.out, System.err).run(args));
    }

    /** @return 프로세스 종료 코드 */
    int run(String[] args) {
        try {
            CliArgs cli = CliArgs.parse(args);
            switch (cli.command()) {
                case "seeds":           seeds(cli); break;
                case "multi-seeds":     multiSeeds(cli); break;
                case "import-precheck": importPrecheck(cli); break;
                default:
                    throw new IllegalArgumentException("Unknown command: \"" + cli.command() + "\"");
            }
            return 0;
        } catch (SeedForgeException | IllegalArgumentException | IOException e) {
            LOG.log(Level.SEVERE, "Command failed: " + e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void seeds(CliArgs cli) throws IOException {
        OutputFormat format = OutputFormat.parse(cli.get("format", "text"));
        SeedConfig cfg = loadConfig(cli);
        SeedService service = newService(cli, cfg);
        String doc = service.generateSeeds(format, cli.get("pattern"),
                cli.getInt("workers", 4), cli.flag("precheck-connections"));
        out.println(doc);
    }

    private void multiSeeds(CliArgs cli) throws IOException {
        OutputFormat format = OutputFormat.parse(cli.get("format", "text"));
        SeedConfig cfg = loadConfig(cli);
        SeedConfig.PackingCfg packing = cfg.packing();
        packing.setWorkers(cli.getInt("workers", packing.getWorkers()));
        packing.setSize(cli.getInt("size", packing.getSize()));
        packing.setSingleGroupSize(cli.getInt("single-group-size", packing.getSingleGroupSize()));
        if (cli.has("output")) cfg.setOutputDir(Path.of(cli.get("output")));
        cfg.validate();

        SeedService service = newService(cli, cfg);
        List<String> names = service.generateMultiSeeds(format, cli.get("pattern"), cli.flag("precheck-connections"));
        out.println(new ObjectMapper().writeValueAsString(names));
    }

    private void importPrecheck(CliArgs cli) throws IOException {
        String log = require(cli, "log");
        String output = require(cli, "output");
        JsonLinesJobImporter importer = new JsonLinesJobImporter(Path.of(output), cli.flag("dry-run"));
        ImportSummary summary = new PrecheckImportService(importer).importLog(Path.of(log));
        err.println("Imported " + summary.records() + " records as " + importer.jobId());
        summary.errorsByJob().forEach((job, n) -> {
            if (n > 0) err.println("  " + job + ": " + n + " errors");
        });
    }

    // ---------- wiring ----------

    static SeedConfig loadConfig(CliArgs cli) throws IOException {
        return cli.has("config")
                ? YamlConfigLoader.load(Path.of(cli.get("config")))
                : SeedConfig.defaults();
    }

    private static SeedService newService(CliArgs cli, SeedConfig cfg) throws IOException {
        IUrlCatalog catalog = new FilteringUrlCatalog(
                new FileUrlSource(Path.of(cli.get("urls", DEFAULT_URLS_FILE))),
                cfg.getIgnoreUrls());

        SeedConfig.PrecheckCfg pre = cfg.precheck();
        PrecheckExemptions exemptions = PrecheckExemptions.parse(pre.getExemptions());
        if (cli.has("exemptions")) {
            exemptions = exemptions.merge(PrecheckExemptions.load(Path.of(cli.get("exemptions"))));
        }
        Prechecker prechecker = new Prechecker(pre.getConcurrency(),
                () -> new HttpHostProbe(pre), exemptions, Clock.systemUTC());
        return new SeedService(cfg, catalog, prechecker);
    }

    private static String require(CliArgs cli, String name) {
        String v = cli.get(name);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("--" + name + " is required");
        return v;
    }
}
