package com.tradinggrok.core.persistence;

import com.tradinggrok.core.model.IntentReason;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.OrderSide;
import com.tradinggrok.core.model.PendingOrder;
import com.tradinggrok.core.model.Position;
import com.tradinggrok.core.model.Thresholds;
import com.tradinggrok.core.orchestrator.OrchestratorState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LedgerStateStore Tests")
class LedgerStateStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-12T15:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Missing file loads as empty")
    void testMissingFile() {
        LedgerStateStore store = new LedgerStateStore(tempDir.resolve("state.json"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("Saved state loads back unchanged")
    void testRoundTrip() {
        Thresholds thresholds = new Thresholds(new BigDecimal("95.00"), new BigDecimal("115.00"));
        OrderIntent entry = OrderIntent.entry("MSFT", 25, new BigDecimal("100.00"), thresholds);
        Position pending = Position.pendingEntry("MSFT", 25, new BigDecimal("100.00"), thresholds, "o-7", T0);
        Position open = Position.pendingEntry("AAPL", 10, new BigDecimal("100.00"), thresholds, "o-1", T0)
            .filled(10, new BigDecimal("100.00"), thresholds)
            .marked(new BigDecimal("101.25"))
            .exitSubmitted("o-2", IntentReason.SIGNAL);
        PendingOrder entryOrder = new PendingOrder(entry, new OrderHandle("o-7", "MSFT", OrderSide.BUY, T0), T0);
        PendingOrder unknownExit = new PendingOrder(
            OrderIntent.exit("AAPL", 10, new BigDecimal("101.25"), IntentReason.SIGNAL), null, T0);
        PersistedState state = new PersistedState(OrchestratorState.EMERGENCY_STOPPED,
            List.of(open, pending), List.of(entryOrder, unknownExit), T0);

        LedgerStateStore store = new LedgerStateStore(tempDir.resolve("nested/state.json"));
        store.save(state);

        assertThat(store.load()).contains(state);
    }

    @Test
    @DisplayName("Save replaces the previous file and leaves no temp files")
    void testOverwrite() throws Exception {
        Path file = tempDir.resolve("state.json");
        LedgerStateStore store = new LedgerStateStore(file);

        store.save(new PersistedState(OrchestratorState.RUNNING, List.of(), List.of(), T0));
        store.save(new PersistedState(OrchestratorState.STOPPED, List.of(), List.of(), T0.plusSeconds(60)));

        assertThat(store.load()).map(PersistedState::orchestratorState).contains(OrchestratorState.STOPPED);
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    @DisplayName("Corrupt file fails loudly")
    void testCorruptFile() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new LedgerStateStore(file).load())
            .isInstanceOf(UncheckedIOException.class);
    }
}
