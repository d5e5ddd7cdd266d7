package br.edu.ifba.graphmemory.storage.impl;

import br.edu.ifba.graphmemory.storage.TemporalGraphStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryTemporalGraphStoreTest extends TemporalGraphStoreContractTest {

    @Override
    protected TemporalGraphStore createStore() {
        return new InMemoryTemporalGraphStore();
    }

    @Test
    @DisplayName("calls before initialize fail fast")
    void testRequiresInitialize() {
        InMemoryTemporalGraphStore fresh = new InMemoryTemporalGraphStore();

        assertThrows(IllegalStateException.class, () -> fresh.getNodes(NS));
    }
}
