package com.example.jozin;

import com.example.jozin.sidecar.SidecarJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar jozin.jar <scan|cleanup> <config.json>";

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command and prints its JSON response to {@code out}, or a JSON error to {@code err}.
     * Returns the process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        ObjectMapper mapper = SidecarJson.newMapper();
        try {
            if (args.length < 2) {
                throw ScanException.user(USAGE);
            }
            ScanConfig config = new ConfigLoader().load(Path.of(args[1]));
            Instant started = Instant.now();
            Object data = execute(args[0], config);
            OperationResponse<Object> response = OperationResponse.of(data, started, Instant.now());
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            return 0;
        } catch (ScanException ex) {
            LOGGER.error("{} failed: {}", args.length > 0 ? args[0] : "command", ex.describe());
            err.println(errorJson(mapper, ex));
            return ex.exitCode();
        } catch (JsonProcessingException ex) {
            ScanException internal = ScanException.internal("Failed to render response", ex);
            LOGGER.error(internal.describe(), ex);
            err.println(errorJson(mapper, internal));
            return internal.exitCode();
        }
    }

    private static Object execute(String command, ScanConfig config) throws ScanException {
        switch (command) {
            case "scan":
                return new SidecarScanner().scan(config, App::logProgress);
            case "cleanup":
                return new SidecarCleaner().cleanup(config, App::logProgress);
            default:
                throw ScanException.user("Unknown command '" + command + "'. " + USAGE);
        }
    }

    private static void logProgress(ProgressEvent event) {
        if (event.type() != ProgressEvent.Type.COMPLETED) {
            return;
        }
        if (event.success()) {
            LOGGER.info("{} ... ok", event.path());
        } else {
            LOGGER.info("{} ... failed: {}", event.path(), event.error());
        }
    }

    private static String errorJson(ObjectMapper mapper, ScanException ex) {
        ErrorReport report = new ErrorReport(ex.kind().label(), ex.getMessage(), ex.exitCode());
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException renderFailure) {
            LOGGER.warn("Failed to render error report", renderFailure);
            return ex.describe();
        }
    }

    record ErrorReport(String kind, String message, int exitCode) {
    }
}
