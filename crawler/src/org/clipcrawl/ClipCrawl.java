package org.clipcrawl;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.clipcrawl.config.JobConfig;
import org.clipcrawl.db.FrontierTarget;
import org.clipcrawl.ingest.IngestCoordinator;
import org.clipcrawl.ingest.Ingestion;
import org.clipcrawl.ingest.PassHandle;
import org.clipcrawl.ingest.PassStatus;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

public class ClipCrawl {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(ClipCrawl.class);

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("data");
        boolean dumpConfig = false;
        boolean resume = false;
        boolean statusOnly = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                case "--resume", "-r" -> resume = true;
                case "--status" -> statusOnly = true;
                case "--log-file" -> startLogFile(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: clipcrawl [options]");
                    System.out.println("Options:");
                    System.out.println("  -h, --help");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -j, --job-dir DIR        Directory for job data and config.yaml");
                    System.out.println("      --log-file FILE      Also write the log to FILE");
                    System.out.println("  -r, --resume             Resume the last pass from its checkpoint");
                    System.out.println("      --status             Print the last checkpoint and exit");
                    System.exit(0);
                }
                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
                }
            }
        }

        ObjectMapper mapper = yamlMapper();
        JobConfig config = loadConfig(mapper, jobDir);
        if (dumpConfig) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        Ingestion ingestion = new Ingestion(jobDir, config);
        if (statusOnly) {
            var checkpoint = ingestion.db().checkpoint();
            System.out.println("pass " + checkpoint.pass() + " " + checkpoint.state() + ", " + checkpoint.commitSeq() +
                               " commits, last at " + checkpoint.committedAt());
            ingestion.close();
            return;
        }

        AtomicReference<PassHandle> running = new AtomicReference<>();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                PassHandle handle = running.get();
                if (handle != null && !handle.state().isFinal()) {
                    log.info("Shutting down, cancelling pass {}", handle.pass());
                }
                ingestion.close();
            } catch (Exception e) {
                System.err.println("Error shutting down: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook"));

        PassHandle handle = resume
                ? ingestion.resumeIngestion(ingestion.db().checkpoint())
                : ingestion.startIngestion();
        running.set(handle);
        PassStatus status = ingestion.await(handle);

        for (FrontierTarget failure : status.failures()) {
            System.out.println("FAILED " + failure.failure() + " " + failure.targetKey() + ": " + failure.error());
        }
        System.out.println("Pass " + status.pass() + " " + status.state() + ": " + status.completed() +
                           " targets completed, " + status.failures().size() + " failed, " +
                           status.unresolvedReferences() + " unresolved references");
        if (status.state() != IngestCoordinator.State.DONE) System.exit(2);
    }

    static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the bundled defaults overlaid with the job directory's {@code config.yaml}, if any.
     */
    static JobConfig loadConfig(ObjectMapper mapper, Path jobDir) throws IOException {
        JsonNode configTree;
        try (InputStream defaults = ClipCrawl.class.getResourceAsStream("config/defaults.yaml")) {
            if (defaults == null) throw new IOException("config/defaults.yaml missing from classpath");
            configTree = mapper.readTree(defaults);
        }
        Path configFile = jobDir.resolve("config.yaml");
        if (Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        JobConfig config = mapper.treeToValue(configTree, JobConfig.class);
        if (config.portal() == null) throw new IOException("portal section missing from " + configFile);
        if (config.portal().username() == null || config.portal().password() == null) {
            throw new IOException("portal.username and portal.password must be set in " + configFile);
        }
        return config;
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    private static void startLogFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %logger{0} %msg %kvp%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("log-file");
        fileAppender.setFile(file);
        fileAppender.start();

        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
    }
}
