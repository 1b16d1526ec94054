package com.apichain.cli;

import com.apichain.dto.response.CommandResponse;
import com.apichain.service.api.StateService;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Stores the static credential sequence runs attach to secured operations.
 */
@ShellComponent
public class AuthCommand {

    private final StateService stateService;

    public AuthCommand(StateService stateService) {
        this.stateService = stateService;
    }

    /**
     * The credential is applied according to each operation's security scheme: as an API key header,
     * query parameter or cookie, as a bearer token, or as {@code user:password} for HTTP basic.
     */
    @ShellMethod(key = "auth", value = "Configure the credential used when running an API's sequences.")
    public String auth(
            @ShellOption(help = "The alias of the API.") String alias,
            @ShellOption(help = "The API key, bearer token, or user:password.") String token
    ) {
        if (stateService.getSpecification(alias) == null) {
            return CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString();
        }
        if (token == null || token.isBlank()) {
            return CommandResponse.error("The credential must not be empty.").toAnsiString();
        }
        stateService.saveCredential(alias, token);
        return new CommandResponse(true, "Successfully configured authentication for '" + alias + "'").toAnsiString();
    }
}
