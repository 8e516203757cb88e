package org.faculty.app.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.faculty.app.service.AnalyticsContext;
import org.faculty.app.service.FacultyAnalyticsService;
import org.faculty.config.AnalyticsConfig;
import org.faculty.config.ConfigurationProvider;
import org.faculty.exception.InputValidationException;
import org.faculty.io.json.RequestReader;
import org.faculty.io.json.ResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Command line entry point: {@code faculty-analytics <command> [--config <file.yaml>]}.
 * <p>
 * Reads one JSON request from stdin (for commands that take input) and prints exactly one
 * JSON object to stdout. Logs go to stderr.
 * <p>
 * Exit status: 0 whenever a command ran, including logical failures reported with
 * {@code "success": false} and unknown commands; 1 for faults outside any command such as
 * unreadable input or configuration.
 */
public final class FacultyAnalyticsCli {

    private static final Logger log = LoggerFactory.getLogger(FacultyAnalyticsCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAULT = 1;

    private final ObjectMapper mapper;
    private final ResponseWriter writer;
    private final Function<AnalyticsConfig, AnalyticsContext> contextFactory;

    public FacultyAnalyticsCli() {
        this(new ObjectMapper(), null);
    }

    FacultyAnalyticsCli(ObjectMapper mapper, Function<AnalyticsConfig, AnalyticsContext> contextFactory) {
        this.mapper = mapper;
        this.writer = new ResponseWriter(mapper);
        this.contextFactory = contextFactory != null
                ? contextFactory
                : config -> AnalyticsContext.fromConfig(config, mapper);
    }

    public static void main(String[] args) {
        int exitCode = new FacultyAnalyticsCli().run(args, System.in, System.out);
        System.exit(exitCode);
    }

    int run(String[] args, InputStream stdin, PrintStream stdout) {
        if (args == null || args.length == 0) {
            log.error("Usage: faculty-analytics <command> [--config <file.yaml>]");
            print(stdout, writer.failure("Missing command"));
            return EXIT_FAULT;
        }

        String commandName = args[0];
        Optional<Command> command = Command.byName(commandName);
        if (command.isEmpty()) {
            print(stdout, writer.failure("Unknown command: " + commandName));
            return EXIT_OK;
        }

        try {
            AnalyticsConfig config = AnalyticsConfig.load(configLocation(args));
            RequestReader request = new RequestReader(
                    command.get().readsInput() ? readRequest(stdin) : null, mapper
            );

            ObjectNode result;
            try (AnalyticsContext context = contextFactory.apply(config)) {
                result = execute(command.get(), new FacultyAnalyticsService(context), request, config);
            }
            print(stdout, result);
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Command {} aborted", commandName, e);
            print(stdout, writer.failure(e.getMessage()));
            return EXIT_FAULT;
        }
    }

    private ObjectNode execute(Command command,
                               FacultyAnalyticsService service,
                               RequestReader request,
                               AnalyticsConfig config) {
        log.info("Running command {}", command.commandName());
        try {
            ObjectNode result = command.execute(service, request, writer, config);
            log.info("Command {} finished", command.commandName());
            return result;
        } catch (RuntimeException e) {
            log.warn("Command {} failed: {}", command.commandName(), e.toString());
            log.debug("Failure detail", e);
            return writer.failure(e.getMessage());
        }
    }

    private JsonNode readRequest(InputStream stdin) throws IOException {
        JsonNode root = mapper.readTree(stdin);
        if (root == null || root.isMissingNode()) {
            throw new InputValidationException("Expected a JSON request on standard input");
        }
        return root;
    }

    static String configLocation(String[] args) {
        int i = Arrays.asList(args).indexOf("--config");
        if (i < 0) {
            return ConfigurationProvider.DEFAULT_LOCATION;
        }
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("--config requires a file path");
        }
        return args[i + 1];
    }

    private void print(PrintStream stdout, ObjectNode node) {
        try {
            stdout.println(mapper.writeValueAsString(node));
            stdout.flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize response", e);
        }
    }
}
