package com.apichain.service.support;

import com.apichain.model.ApiMethod;
import com.apichain.model.OperationKey;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValueBindingTableTest {

    @Test
    void lookupLoose_shouldPreferExactNameThenMostRecentMatch() {
        ValueBindingTable table = new ValueBindingTable();
        table.bind("id", 1L, new OperationKey(ApiMethod.POST, "/items"));
        table.bind("id", 2L, new OperationKey(ApiMethod.POST, "/items"));
        table.bind("itemId", 9L, null);

        assertThat(table.lookupLoose("itemId")).map(ValueBindingTable.Binding::value).contains(9L);
        assertThat(table.lookup("id")).map(ValueBindingTable.Binding::value).contains(2L);
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void lookupLoose_shouldUseProducerPathForBareId() {
        ValueBindingTable table = new ValueBindingTable();
        table.bind("id", 5L, new OperationKey(ApiMethod.POST, "/orders"));

        assertThat(table.lookupLoose("orderId")).map(ValueBindingTable.Binding::value).contains(5L);
        assertThat(table.lookupLoose("itemId")).isEmpty();
    }

    @Test
    void seed_shouldBindWithoutSource() {
        ValueBindingTable table = new ValueBindingTable();
        table.seed(Map.of("tenant", "acme"));

        assertThat(table.lookup("tenant")).hasValueSatisfying(binding -> {
            assertThat(binding.value()).isEqualTo("acme");
            assertThat(binding.source()).isNull();
        });
        assertThat(table.snapshot()).containsExactly(Map.entry("tenant", "acme"));
    }
}
