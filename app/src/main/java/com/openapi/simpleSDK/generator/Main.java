package com.openapi.simpleSDK.generator;

import com.openapi.simpleSDK.generator.cli.GeneratorCommand;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("Starting OpenAPI IR loader");
        logger.debug("Arguments: {}", Arrays.toString(args));

        int exitCode = new CommandLine(new GeneratorCommand()).execute(args);

        if (exitCode != 0) {
            logger.warn("Loader finished with exit code {}", exitCode);
        } else {
            logger.info("Loader finished");
        }
        System.exit(exitCode);
    }
}
