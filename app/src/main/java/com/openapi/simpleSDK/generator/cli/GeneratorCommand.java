package com.openapi.simpleSDK.generator.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.simpleSDK.generator.SpecLoader;
import com.openapi.simpleSDK.generator.SpecReader;
import com.openapi.simpleSDK.generator.SpecResult;
import com.openapi.simpleSDK.generator.ir.IROperation;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import com.openapi.simpleSDK.generator.ir.IRSpec;
import com.openapi.simpleSDK.generator.parsing.CycleLimitExceededException;
import com.openapi.simpleSDK.generator.parsing.ParsingOptions;
import com.openapi.simpleSDK.generator.parsing.SpecStructureException;
import com.openapi.simpleSDK.generator.validation.SwaggerSpecValidator;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(
    name = "openapi-sdk-generator",
    description = "Resolve an OpenAPI document into the intermediate representation used for client generation",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class GeneratorCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GeneratorCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_STRUCTURE_ERROR = 2;
    static final int EXIT_CYCLE_LIMIT = 3;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    @CommandLine.Parameters(
        index = "0",
        description = "OpenAPI specification file (.json, .yaml or .yml)"
    )
    private Path specFile;

    @CommandLine.Option(
        names = {"--max-depth"},
        description = "Maximum schema nesting depth (default: SIMPLESDK_MAX_DEPTH or 100)"
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = {"--debug-cycles"},
        description = "Report every detected schema cycle with its parsing path"
    )
    private boolean debugCycles;

    @CommandLine.Option(
        names = {"--max-cycles"},
        description = "Abort after this many detected cycles, 0 disables the limit (default: SIMPLESDK_MAX_CYCLES or 0)"
    )
    private Integer maxCycles;

    @CommandLine.Option(
        names = {"--validate"},
        description = "Validate the document with swagger-parser and report its messages as warnings"
    )
    private boolean validate;

    @Override
    public Integer call() {
        PrintWriter out = commandSpec.commandLine().getOut();
        ParsingOptions options = parsingOptions();
        logger.info("Specification file: {}", specFile);
        logger.info("Parsing options: {}", options);

        try {
            JsonNode document = new SpecReader().read(specFile);
            SpecLoader loader = new SpecLoader(document, options, validate ? new SwaggerSpecValidator() : null);
            SpecResult result = loader.load();
            printSummary(out, result);
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Could not read specification {}", specFile, e);
            return EXIT_IO_ERROR;
        } catch (SpecStructureException e) {
            logger.error("Invalid specification {}: {}", specFile, e.getMessage());
            return EXIT_STRUCTURE_ERROR;
        } catch (CycleLimitExceededException e) {
            logger.error("Aborted: {}", e.getMessage());
            return EXIT_CYCLE_LIMIT;
        }
    }

    ParsingOptions parsingOptions() {
        ParsingOptions options = ParsingOptions.fromEnvironment();
        if (maxDepth != null) {
            options = options.withMaxDepth(maxDepth);
        }
        if (debugCycles) {
            options = options.withDebugCycles(true);
        }
        if (maxCycles != null) {
            options = options.withMaxCycles(maxCycles);
        }
        return options;
    }

    private void printSummary(PrintWriter out, SpecResult result) {
        IRSpec spec = result.spec();
        out.printf("%s %s%n", spec.title(), spec.version());
        out.printf("Schemas: %d%n", spec.schemas().size());
        for (Map.Entry<String, IRSchema> entry : spec.schemas().entrySet()) {
            IRSchema schema = entry.getValue();
            out.printf("  %s -> %s (%s)%n", entry.getKey(), schema.getGenerationName(), schema.getFinalModuleStem());
        }
        out.printf("Operations: %d%n", spec.operations().size());
        for (IROperation operation : spec.operations()) {
            out.printf("  %s %s %s%n", operation.method(), operation.path(), operation.operationId());
        }
        out.printf("Warnings: %d%n", result.warnings().size());
        result.warnings().forEach(warning -> out.printf("  %s%n", warning));
        out.flush();
    }
}
