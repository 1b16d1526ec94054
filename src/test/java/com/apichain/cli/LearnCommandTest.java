package com.apichain.cli;

import com.apichain.exception.ApiChainException;
import com.apichain.model.ApiSpecification;
import com.apichain.service.api.OpenApiService;
import com.apichain.service.api.StateService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LearnCommandTest {

    @Mock
    private OpenApiService openApiService;
    @Mock
    private StateService stateService;

    @InjectMocks
    private LearnCommand learnCommand;

    @Test
    void learn_shouldStoreParsedSpecification() {
        ApiSpecification spec = new ApiSpecification();
        when(openApiService.loadAndParseSpec("inventory.json")).thenReturn(spec);

        String output = learnCommand.learn("inventory", "inventory.json");

        assertThat(output).contains("Successfully learned API 'inventory' (0 operations)");
        verify(stateService).saveSpecification("inventory", spec);
    }

    @Test
    void learn_shouldReportParseFailure() {
        when(openApiService.loadAndParseSpec(anyString())).thenThrow(new ApiChainException("Failed to load"));

        String output = learnCommand.learn("inventory", "missing.json");

        assertThat(output).contains("Failed to learn API: Failed to load");
        verify(stateService, never()).saveSpecification(anyString(), any());
    }
}
