package com.specharvest.infrastructure.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds the variables of a {@code .env} file (working directory, or the
 * directory named by {@code HARVEST_DOTENV_DIR}) ahead of every other property
 * source, so credentials such as {@code SCRAPINGBEE_API_KEYS} and
 * {@code MONGO_DB_PASSWORD} can live outside the shell environment.
 */
public class DotenvEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String SOURCE_NAME = "harvestDotenv";
    static final String DIRECTORY_VARIABLE = "HARVEST_DOTENV_DIR";

    private final Log logger;

    public DotenvEnvironmentPostProcessor(DeferredLogFactory logFactory) {
        this.logger = logFactory.getLog(DotenvEnvironmentPostProcessor.class);
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String directory = environment.getProperty(DIRECTORY_VARIABLE, ".");
        Map<String, Object> variables = loadVariables(directory);
        if (variables.isEmpty()) {
            logger.debug("No .env variables found in " + directory);
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(SOURCE_NAME, variables));
        logger.info("Loaded " + variables.size() + " variables from " + directory + "/.env");
    }

    /**
     * Reads only the variables declared in the file; blank values are dropped
     * so the defaults in application.properties still apply.
     */
    static Map<String, Object> loadVariables(String directory) {
        Dotenv dotenv = Dotenv.configure()
            .directory(directory)
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

        Map<String, Object> variables = new LinkedHashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            if (entry.getValue() != null && !entry.getValue().isBlank()) {
                variables.put(entry.getKey(), entry.getValue().trim());
            }
        }
        return variables;
    }
}
