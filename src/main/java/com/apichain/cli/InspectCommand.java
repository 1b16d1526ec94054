package com.apichain.cli;

import com.apichain.dto.response.CommandResponse;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiSpecification;
import com.apichain.model.OperationKey;
import com.apichain.model.SecuritySchemeInfo;
import com.apichain.service.api.StateService;
import java.util.Map;
import java.util.Optional;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands for looking at what was learned about an API: its operations, their attributes and its security schemes.
 */
@ShellComponent
public class InspectCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private final StateService stateService;

    public InspectCommand(StateService stateService) {
        this.stateService = stateService;
    }

    /**
     * Lists every operation, or one operation when a signature such as {@code "GET /items/{itemId}"} is given.
     */
    @ShellMethod(key = "details", value = "Show operations and their input/output attributes for a learned API.")
    public void details(
            @ShellOption(help = "The alias of the API to inspect.") String alias,
            @ShellOption(value = {"--operation", "-o"}, help = "An operation signature, e.g. 'GET /items/{itemId}'.", defaultValue = ShellOption.NULL) String signature
    ) {
        ApiSpecification spec = stateService.getSpecification(alias);
        if (spec == null) {
            System.out.println(CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString());
            return;
        }

        if (signature != null) {
            Optional<ApiOperation> operation;
            try {
                operation = spec.findOperation(OperationKey.parse(signature));
            } catch (IllegalArgumentException e) {
                System.out.println(CommandResponse.error(e.getMessage()).toAnsiString());
                return;
            }
            if (operation.isEmpty()) {
                System.out.println(CommandResponse.error("Operation '" + signature + "' not found in API '" + alias + "'.").toAnsiString());
                return;
            }
            System.out.println(ANSI_CYAN + "Details for Operation: " + ANSI_YELLOW + signature + ANSI_RESET);
            printOperationDetails(operation.get());
        } else {
            System.out.println(ANSI_CYAN + "Available Operations for API: " + ANSI_YELLOW + alias + ANSI_RESET);
            spec.getOperations().forEach(this::printOperationDetails);
        }
    }

    private void printOperationDetails(ApiOperation op) {
        System.out.println("-".repeat(50));
        System.out.println(ANSI_PURPLE + op.getMethod() + ANSI_RESET + " " + op.getPath()
                + ANSI_GREEN + "  (" + op.getOperationId() + ")" + ANSI_RESET);
        if (op.getSummary() != null) {
            System.out.println("  Summary: " + op.getSummary());
        }
        if (!op.getParameters().isEmpty()) {
            System.out.println(ANSI_CYAN + "  Parameters:" + ANSI_RESET);
            op.getParameters().forEach(p ->
                    System.out.println("    - " + p.getName() + " (in: " + p.getIn() + ", required: " + p.isRequired() + ")"));
        }
        System.out.println(ANSI_CYAN + "  Input attributes: " + ANSI_RESET + op.getInputAttributes());
        System.out.println(ANSI_CYAN + "  Output attributes: " + ANSI_RESET + op.getOutputAttributes());
    }

    @ShellMethod(key = "auth-info", value = "Show authentication info for a learned API.")
    public void authInfo(@ShellOption(help = "The alias of the API to inspect.") String alias) {
        ApiSpecification spec = stateService.getSpecification(alias);
        if (spec == null) {
            System.out.println(CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString());
            return;
        }

        Map<String, SecuritySchemeInfo> securitySchemes = spec.getSecuritySchemes();
        if (securitySchemes == null || securitySchemes.isEmpty()) {
            System.out.println(ANSI_YELLOW + "No security schemes defined for API '" + alias + "'." + ANSI_RESET);
            return;
        }

        System.out.println(ANSI_CYAN + "Authentication Information for API: " + ANSI_YELLOW + alias + ANSI_RESET);
        securitySchemes.forEach((name, scheme) -> {
            System.out.println("-".repeat(50));
            System.out.println(ANSI_GREEN + "Scheme Name: " + ANSI_YELLOW + name + ANSI_RESET);
            System.out.println("  Type: " + scheme.type());
            if (scheme.isApiKey()) {
                System.out.println("  Location: " + scheme.in());
                System.out.println("  Header/Parameter Name: " + scheme.name());
            } else if (scheme.isHttp()) {
                System.out.println("  Scheme: " + scheme.scheme());
            }
            String usage = scheme.isHttp() && "basic".equalsIgnoreCase(scheme.scheme())
                    ? "auth --alias " + alias + " --token user:password"
                    : "auth --alias " + alias + " --token <value>";
            System.out.println(ANSI_CYAN + "  How to use: " + usage + ANSI_RESET);
        });
    }
}
