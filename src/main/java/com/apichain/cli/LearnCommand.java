package com.apichain.cli;

import com.apichain.dto.response.CommandResponse;
import com.apichain.model.ApiSpecification;
import com.apichain.service.api.OpenApiService;
import com.apichain.service.api.StateService;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Learns an API from its OpenAPI document and stores the normalized result under an alias.
 */
@ShellComponent
public class LearnCommand {

    private final OpenApiService openApiService;
    private final StateService stateService;

    public LearnCommand(OpenApiService openApiService, StateService stateService) {
        this.openApiService = openApiService;
        this.stateService = stateService;
    }

    /**
     * @param alias  a unique alias used by every later command.
     * @param source the URL or file path of the OpenAPI document.
     * @return the ANSI-coloured result.
     */
    @ShellMethod(key = "learn", value = "Learns an API from an OpenAPI specification.")
    public String learn(
            @ShellOption(help = "A unique alias for this API.") String alias,
            @ShellOption(help = "The URL or file path of the OpenAPI spec.") String source
    ) {
        CommandResponse response;
        try {
            ApiSpecification spec = openApiService.loadAndParseSpec(source);
            stateService.saveSpecification(alias, spec);
            response = CommandResponse.ok("Successfully learned API '" + alias + "' (" + spec.getOperations().size() + " operations).",
                    List.of("Next: 'graph --alias " + alias + "' or 'generate-sequences --alias " + alias + "'."));
        } catch (Exception e) {
            response = CommandResponse.error("Failed to learn API: " + e.getMessage());
        }
        return response.toAnsiString();
    }
}
