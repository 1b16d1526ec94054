package com.apichain.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.apichain.cli.ui.Spinner;
import com.apichain.dto.response.CommandResponse;
import com.apichain.model.ApiSpecification;
import com.apichain.model.ExecutionOptions;
import com.apichain.model.ExecutionStep;
import com.apichain.model.FailurePolicy;
import com.apichain.model.OperationSequence;
import com.apichain.model.SequenceExecutionResult;
import com.apichain.model.SequenceGenerationResult;
import com.apichain.model.SequenceStatus;
import com.apichain.model.SequenceStrategy;
import com.apichain.service.api.DependencyGraphBuilder;
import com.apichain.service.api.SequenceGenerator;
import com.apichain.service.api.SequenceRunner;
import com.apichain.service.api.StateService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands that generate, list and run operation sequences.
 */
@ShellComponent
public class SequenceCommand {

    private static final String APP_LOGGER = "com.apichain";

    private final StateService stateService;
    private final DependencyGraphBuilder graphBuilder;
    private final SequenceGenerator sequenceGenerator;
    private final SequenceRunner sequenceRunner;
    private final Spinner spinner;
    private final ObjectMapper jsonMapper = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Value("${runner.timeout-ms:5000}")
    private long defaultTimeoutMs = 5000;

    @Value("${runner.max-concurrent-sequences:4}")
    private int defaultConcurrency = 4;

    public SequenceCommand(StateService stateService,
                           DependencyGraphBuilder graphBuilder,
                           SequenceGenerator sequenceGenerator,
                           SequenceRunner sequenceRunner,
                           Spinner spinner) {
        this.stateService = stateService;
        this.graphBuilder = graphBuilder;
        this.sequenceGenerator = sequenceGenerator;
        this.sequenceRunner = sequenceRunner;
        this.spinner = spinner;
    }

    @ShellMethod(key = "generate-sequences", value = "Generate operation sequences from the dependency graph and store them.")
    public String generateSequences(
            @ShellOption(help = "The alias of the API.") String alias,
            @ShellOption(help = "CHAIN (one sequence per operation) or GREEDY (one global order).", defaultValue = "CHAIN") String strategy,
            @ShellOption(help = "Discard previously stored sequences.", defaultValue = "false") boolean override
    ) {
        ApiSpecification spec = stateService.getSpecification(alias);
        if (spec == null) {
            return CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString();
        }
        SequenceStrategy chosen;
        try {
            chosen = SequenceStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CommandResponse.error("Unknown strategy '" + strategy + "'. Use CHAIN or GREEDY.").toAnsiString();
        }

        SequenceGenerationResult result = sequenceGenerator.generate(graphBuilder.build(spec.getOperations()), chosen);
        int stored = stateService.saveSequences(alias, result.sequences(), override);
        List<String> details = new ArrayList<>();
        result.warnings().forEach(w -> details.add("  warning: " + w.describe()));
        return CommandResponse.ok("Generated " + result.sequences().size() + " " + chosen + " sequence(s); "
                + stored + " stored for '" + alias + "'.", details).toAnsiString();
    }

    @ShellMethod(key = "list-sequences", value = "List the stored sequences of an API.")
    public String listSequences(@ShellOption(help = "The alias of the API.") String alias) {
        List<OperationSequence> sequences = stateService.getSequences(alias);
        if (sequences.isEmpty()) {
            return CommandResponse.error("No sequences stored for '" + alias + "'. Run 'generate-sequences' first.").toAnsiString();
        }
        List<String> lines = new ArrayList<>();
        for (OperationSequence sequence : sequences) {
            lines.add("  " + sequence.getId() + "  " + sequence.getName() + "  " + sequence.getOperations()
                    + (sequence.getWarnings().isEmpty() ? "" : "  (" + sequence.getWarnings().size() + " warning(s))"));
        }
        return CommandResponse.ok(sequences.size() + " sequence(s) for '" + alias + "':", lines).toAnsiString();
    }

    @ShellMethod(key = "run", value = "Run stored sequences against a live server.")
    public String run(
            @ShellOption(help = "The alias of the API.") String alias,
            @ShellOption(help = "Run only the sequence with this id.", defaultValue = ShellOption.NULL) String sequence,
            @ShellOption(value = "--base-url", help = "Server to run against; defaults to the spec's first server.", defaultValue = ShellOption.NULL) String baseUrl,
            @ShellOption(value = "--abort-on-failure", help = "Stop a sequence at its first failed step.", defaultValue = "false") boolean abortOnFailure,
            @ShellOption(help = "Maximum sequences running at once.", defaultValue = ShellOption.NULL) Integer concurrency,
            @ShellOption(value = "--timeout-ms", help = "Per-request timeout in milliseconds.", defaultValue = ShellOption.NULL) Long timeoutMs,
            @ShellOption(help = "Write the results as JSON to this file.", defaultValue = ShellOption.NULL) String output,
            @ShellOption(help = "Log every step at DEBUG level.", defaultValue = "false") boolean verbose
    ) {
        ApiSpecification spec = stateService.getSpecification(alias);
        if (spec == null) {
            return CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString();
        }
        List<OperationSequence> sequences = stateService.getSequences(alias).stream()
                .filter(s -> sequence == null || s.getId().equals(sequence))
                .toList();
        if (sequences.isEmpty()) {
            return CommandResponse.error(sequence == null
                    ? "No sequences stored for '" + alias + "'. Run 'generate-sequences' first."
                    : "No sequence with id '" + sequence + "' for '" + alias + "'.").toAnsiString();
        }

        ExecutionOptions options = ExecutionOptions.builder()
                .baseUrl(baseUrl)
                .credential(stateService.getCredential(alias))
                .failurePolicy(abortOnFailure ? FailurePolicy.ABORT_ON_FAILURE : FailurePolicy.CONTINUE)
                .maxConcurrentSequences(concurrency != null ? concurrency : defaultConcurrency)
                .timeout(Duration.ofMillis(timeoutMs != null ? timeoutMs : defaultTimeoutMs))
                .build();

        Logger appLogger = (Logger) LoggerFactory.getLogger(APP_LOGGER);
        Level previous = appLogger.getLevel();
        if (verbose) {
            appLogger.setLevel(Level.DEBUG);
        }
        List<SequenceExecutionResult> results;
        try {
            results = spinner.spin("Running " + sequences.size() + " sequence(s)",
                    () -> sequenceRunner.runAll(sequences, spec, options));
        } catch (Exception e) {
            return CommandResponse.error("Run failed: " + e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                appLogger.setLevel(previous);
            }
        }

        List<String> lines = new ArrayList<>();
        int clean = 0;
        for (int i = 0; i < results.size(); i++) {
            SequenceExecutionResult result = results.get(i);
            long succeeded = result.getSteps().stream().filter(ExecutionStep::isSucceeded).count();
            lines.add("  " + sequences.get(i).getName() + ": " + result.getStatus() + " (" + succeeded + "/"
                    + sequences.get(i).getOperations().size() + " steps succeeded)"
                    + (result.getAbortReason() == null ? "" : " - " + result.getAbortReason()));
            result.getSteps().stream()
                    .filter(ExecutionStep::isFailed)
                    .forEach(step -> lines.add("      step " + step.getIndex() + " " + step.getOperation() + ": "
                            + step.getFailureReason() + " " + step.getMessage()));
            if (result.getStatus() == SequenceStatus.COMPLETED) {
                clean++;
            }
        }

        if (output != null) {
            try {
                jsonMapper.writeValue(new File(output), results);
                lines.add("  Results written to " + output);
            } catch (IOException e) {
                return CommandResponse.error("Could not write results to " + output + ": " + e.getMessage()).toAnsiString();
            }
        }
        return new CommandResponse(clean == results.size(),
                clean + " of " + results.size() + " sequence(s) completed.", lines).toAnsiString();
    }
}
