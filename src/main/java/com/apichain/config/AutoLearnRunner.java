package com.apichain.config;

import com.apichain.model.ApiSpecification;
import com.apichain.model.SequenceGenerationResult;
import com.apichain.model.SequenceStrategy;
import com.apichain.service.api.DependencyGraphBuilder;
import com.apichain.service.api.OpenApiService;
import com.apichain.service.api.SequenceGenerator;
import com.apichain.service.api.StateService;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Learns every OpenAPI document found in {@code OPENAPI_SPECS_DIR} on startup, generates its sequences,
 * and picks up a credential from {@code API_CHAIN_TOKEN_<ALIAS>} when one is set.
 */
@Component
@Profile("!test")
@Slf4j
public class AutoLearnRunner implements CommandLineRunner {

    @Value("${OPENAPI_SPECS_DIR:/app/specs}")
    private String specsDirectoryPath;

    @Value("${sequence.strategy:CHAIN}")
    private SequenceStrategy strategy;

    private final OpenApiService openApiService;
    private final DependencyGraphBuilder graphBuilder;
    private final SequenceGenerator sequenceGenerator;
    private final StateService stateService;
    private final Function<String, String> environment;

    @Autowired
    public AutoLearnRunner(OpenApiService openApiService,
                           DependencyGraphBuilder graphBuilder,
                           SequenceGenerator sequenceGenerator,
                           StateService stateService) {
        this(openApiService, graphBuilder, sequenceGenerator, stateService, System::getenv);
    }

    AutoLearnRunner(OpenApiService openApiService,
                    DependencyGraphBuilder graphBuilder,
                    SequenceGenerator sequenceGenerator,
                    StateService stateService,
                    Function<String, String> environment) {
        this.openApiService = openApiService;
        this.graphBuilder = graphBuilder;
        this.sequenceGenerator = sequenceGenerator;
        this.stateService = stateService;
        this.environment = environment;
    }

    @Override
    public void run(String... args) {
        File specsDir = new File(specsDirectoryPath);
        if (!specsDir.isDirectory()) {
            log.info("Auto-learn directory not found at '{}'. Skipping.", specsDirectoryPath);
            return;
        }

        File[] specFiles = specsDir.listFiles((dir, name) -> name.toLowerCase(Locale.ROOT).matches(".*\\.(json|ya?ml)$"));
        if (specFiles == null || specFiles.length == 0) {
            log.info("No OpenAPI (.json/.yaml) files found in '{}'. Skipping.", specsDirectoryPath);
            return;
        }
        Arrays.sort(specFiles, Comparator.comparing(File::getName));

        for (File file : specFiles) {
            String alias = aliasFor(file.getName());
            if (stateService.getSpecification(alias) != null) {
                log.info("[LEARN] SKIPPED: API '{}' is already learned.", alias);
                continue;
            }
            try {
                ApiSpecification spec = openApiService.loadAndParseSpec(file.getAbsolutePath());
                stateService.saveSpecification(alias, spec);
                SequenceGenerationResult generated = sequenceGenerator.generate(graphBuilder.build(spec.getOperations()), strategy);
                stateService.saveSequences(alias, generated.sequences(), true);
                log.info("[LEARN] Learned API '{}' from {}: {} operations, {} sequences.",
                        alias, file.getName(), spec.getOperations().size(), generated.sequences().size());
            } catch (Exception e) {
                log.error("[LEARN] FAILED: Could not process '{}': {}", file.getName(), e.getMessage());
                continue;
            }

            String variable = "API_CHAIN_TOKEN_" + alias.toUpperCase(Locale.ROOT).replace('-', '_');
            String token = environment.apply(variable);
            if (token != null && !token.isBlank()) {
                stateService.saveCredential(alias, token);
                log.info("[AUTH] Configured credential for '{}' from environment variable '{}'.", alias, variable);
            }
        }
    }

    /**
     * "Pet Store.openapi.yaml" becomes "pet-store".
     */
    static String aliasFor(String fileName) {
        return fileName.toLowerCase(Locale.ROOT)
                .replaceFirst("(\\.(openapi|swagger))?\\.(json|ya?ml)$", "")
                .replaceAll("[^a-z0-9-]", "-");
    }
}
