package com.apichain.cli;

import com.apichain.TestOperations;
import com.apichain.model.ApiSpecification;
import com.apichain.service.api.StateService;
import com.apichain.service.impl.OpenApiServiceImpl;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InspectCommandTest {

    @Mock
    private StateService stateService;

    @InjectMocks
    private InspectCommand inspectCommand;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void details_shouldPrintSingleOperationWithAttributes() throws Exception {
        ApiSpecification spec = new OpenApiServiceImpl().loadAndParseSpec(TestOperations.fixturePath());
        when(stateService.getSpecification("inventory")).thenReturn(spec);

        inspectCommand.details("inventory", "GET /items/{itemId}");

        String printed = out.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("Details for Operation: ");
        assertThat(printed).contains("/items/{itemId}");
        assertThat(printed).contains("itemId (in: path, required: true)");
        assertThat(printed).contains("Input attributes: ");
    }

    @Test
    void details_shouldReportUnknownOperationAndAlias() throws Exception {
        ApiSpecification spec = new OpenApiServiceImpl().loadAndParseSpec(TestOperations.fixturePath());
        when(stateService.getSpecification("inventory")).thenReturn(spec);
        when(stateService.getSpecification("nope")).thenReturn(null);

        inspectCommand.details("inventory", "GET /missing");
        inspectCommand.details("nope", null);

        String printed = out.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("Operation 'GET /missing' not found in API 'inventory'.");
        assertThat(printed).contains("No API found with alias 'nope'.");
    }

    @Test
    void authInfo_shouldDescribeApiKeyScheme() throws Exception {
        ApiSpecification spec = new OpenApiServiceImpl().loadAndParseSpec(TestOperations.fixturePath());
        when(stateService.getSpecification("inventory")).thenReturn(spec);

        inspectCommand.authInfo("inventory");

        String printed = out.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("ApiKeyAuth");
        assertThat(printed).contains("Location: header");
        assertThat(printed).contains("Header/Parameter Name: X-API-KEY");
        assertThat(printed).contains("auth --alias inventory --token <value>");
    }
}
