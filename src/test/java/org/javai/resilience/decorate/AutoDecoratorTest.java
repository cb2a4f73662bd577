package org.javai.resilience.decorate;

import org.javai.resilience.Fallback;
import org.javai.resilience.RecordingLogSink;
import org.javai.resilience.log.LogLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class AutoDecoratorTest {

    public interface Inventory {
        int reserve(String sku, int quantity) throws IOException;

        String describe(String sku);

        String slowLookup(String sku) throws InterruptedException;

        boolean isOpen();
    }

    static class FlakyInventory implements Inventory {
        final AtomicInteger reserveCalls = new AtomicInteger();
        final AtomicInteger describeCalls = new AtomicInteger();
        int failuresBeforeSuccess;

        @Override
        public int reserve(String sku, int quantity) throws IOException {
            if (reserveCalls.incrementAndGet() <= failuresBeforeSuccess) {
                throw new IOException("warehouse unreachable");
            }
            return quantity;
        }

        @Override
        public String describe(String sku) {
            describeCalls.incrementAndGet();
            if (sku.isEmpty()) {
                throw new IllegalArgumentException("sku must not be empty");
            }
            return "item " + sku;
        }

        @Override
        public String slowLookup(String sku) throws InterruptedException {
            Thread.sleep(2_000);
            return sku;
        }

        @Override
        public boolean isOpen() {
            throw new IllegalStateException("closed for inventory count");
        }

        @Override
        public String toString() {
            return "FlakyInventory";
        }
    }

    private RecordingLogSink sink;
    private AutoDecorator decorator;
    private FlakyInventory inventory;

    @BeforeEach
    void setUp() {
        sink = new RecordingLogSink();
        decorator = AutoDecorator.builder().sink(sink).sleeper(millis -> {}).build();
        inventory = new FlakyInventory();
    }

    private static DecorationPolicy retryThree() {
        return DecorationPolicy.builder().retryAttempts(3).retryDelay(Duration.ofMillis(10)).build();
    }

    // === Proxies ===

    @Test
    void decorate_retriesUntilSuccess() throws IOException {
        inventory.failuresBeforeSuccess = 2;
        Inventory decorated = decorator.decorate(Inventory.class, inventory, retryThree());

        int reserved = decorated.reserve("sku-1", 4);

        assertThat(reserved).isEqualTo(4);
        assertThat(inventory.reserveCalls.get()).isEqualTo(3);
        assertThat(sink.messagesAt(LogLevel.WARN)).hasSize(2)
                .allSatisfy(message -> assertThat(message).startsWith("Inventory.reserve attempt "));
    }

    @Test
    void decorate_exhausted_rethrowsCheckedFaultKind() {
        inventory.failuresBeforeSuccess = Integer.MAX_VALUE;
        Inventory decorated = decorator.decorate(Inventory.class, inventory, retryThree());

        assertThatThrownBy(() -> decorated.reserve("sku-1", 1))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("warehouse unreachable");
        assertThat(inventory.reserveCalls.get()).isEqualTo(3);
        assertThat(sink.messagesAt(LogLevel.ERROR)).containsExactly(
                "Inventory.reserve failed after 3 attempt(s): IOException: warehouse unreachable (fallback: none)");
    }

    @Test
    void decorate_unmatchedFault_reraisedWithoutRetry() {
        DecorationPolicy policy = DecorationPolicy.builder()
                .retryAttempts(3)
                .matching(IOException.class)
                .build();
        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        assertThatThrownBy(() -> decorated.describe(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("sku must not be empty");
        assertThat(inventory.describeCalls.get()).isEqualTo(1);
        assertThat(sink.entries()).isEmpty();
    }

    @Test
    void decorate_singleShot_logsAtPolicyLevelAndReturnsFallback() {
        DecorationPolicy policy = DecorationPolicy.builder()
                .fallback("unknown item")
                .logLevel(LogLevel.WARN)
                .build();
        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        String description = decorated.describe("");

        assertThat(description).isEqualTo("unknown item");
        assertThat(sink.messagesAt(LogLevel.WARN)).contains(
                "Inventory.describe failed - IllegalArgumentException: sku must not be empty, returning fallback: unknown item");
    }

    @Test
    void decorate_nullResultOnPrimitiveReturn_givesZero() throws IOException {
        inventory.failuresBeforeSuccess = 1;
        Inventory decorated = decorator.decorate(Inventory.class, inventory, DecorationPolicy.defaults());

        assertThat(decorated.reserve("sku-1", 5)).isZero();
        assertThat(decorated.reserve("sku-1", 5)).isEqualTo(5);
    }

    @Test
    void decorate_explicitNullFallback_allowedOnPrimitiveReturn() throws IOException {
        inventory.failuresBeforeSuccess = 1;
        DecorationPolicy policy = DecorationPolicy.builder().fallback(Fallback.of(null)).build();
        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        assertThat(decorated.reserve("sku-1", 5)).isZero();
        assertThat(sink.messagesAt(LogLevel.WARN)).isEmpty();
    }

    @Test
    void decorate_incompatibleFallback_skipsThatCapabilityOnly() throws Exception {
        inventory.failuresBeforeSuccess = 1;
        DecorationPolicy policy = DecorationPolicy.builder().fallback("n/a").build();

        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        assertThat(sink.messagesAt(LogLevel.WARN)).containsExactly(
                "Could not decorate Inventory.reserve: fallback n/a is not a int");
        assertThat(AutoDecorator.isDecorated(decorated, Inventory.class.getMethod("reserve", String.class, int.class)))
                .isFalse();
        assertThat(AutoDecorator.isDecorated(decorated, Inventory.class.getMethod("describe", String.class)))
                .isTrue();
        assertThatThrownBy(() -> decorated.reserve("sku-1", 1)).isInstanceOf(IOException.class);
        assertThat(decorated.describe("")).isEqualTo("n/a");
    }

    @Test
    void decorate_propertyAccessorPassesThroughUndecorated() {
        Inventory decorated = decorator.decorate(Inventory.class, inventory, DecorationPolicy.builder().fallback(false).build());

        assertThatThrownBy(decorated::isOpen)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("closed for inventory count");
    }

    @Test
    void decorate_twice_neverNests() throws IOException {
        inventory.failuresBeforeSuccess = Integer.MAX_VALUE;
        Inventory once = decorator.decorate(Inventory.class, inventory, retryThree());

        Inventory twice = decorator.decorate(Inventory.class, once, retryThree());

        assertThat(AutoDecorator.undecorated(twice)).isSameAs(inventory);
        assertThatThrownBy(() -> twice.reserve("sku-1", 1)).isInstanceOf(IOException.class);
        assertThat(inventory.reserveCalls.get()).isEqualTo(3);
    }

    @Test
    void decorate_timeout_returnsFallbackWhenSlow() throws InterruptedException {
        DecorationPolicy policy = DecorationPolicy.builder()
                .timeout(Duration.ofMillis(100))
                .fallback("stale")
                .build();
        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        String result = decorated.slowLookup("sku-1");

        assertThat(result).isEqualTo("stale");
        assertThat(sink.messagesAt(LogLevel.WARN)).contains("Inventory.slowLookup timed out after 100 ms (fallback: stale)");
    }

    @Test
    void decorate_retryInsideTimeout_returnsRetryFallback() throws IOException {
        DecorationPolicy policy = DecorationPolicy.builder()
                .retryAttempts(2)
                .retryDelay(Duration.ZERO)
                .timeout(Duration.ofSeconds(2))
                .fallback(-1)
                .build();
        inventory.failuresBeforeSuccess = Integer.MAX_VALUE;
        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        assertThat(decorated.reserve("sku-1", 1)).isEqualTo(-1);
        assertThat(inventory.reserveCalls.get()).isEqualTo(2);
        assertThat(sink.messagesAt(LogLevel.ERROR)).hasSize(1);
    }

    @Test
    void decorate_timed_logsDuration() {
        DecorationPolicy policy = DecorationPolicy.builder().timed(true).build();
        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy);

        decorated.describe("sku-1");

        assertThat(sink.messagesAt(LogLevel.INFO)).hasSize(2);
        assertThat(sink.messagesAt(LogLevel.INFO).get(0)).isEqualTo("Starting [Inventory.describe]");
        assertThat(sink.messagesAt(LogLevel.INFO).get(1)).startsWith("Finished [Inventory.describe] in ");
    }

    @Test
    void decorate_filterNarrowsCapabilities() throws Exception {
        DecorationPolicy policy = DecorationPolicy.builder().fallback("n/a").build();

        Inventory decorated = decorator.decorate(Inventory.class, inventory, policy, CapabilityFilter.named("describe"));

        assertThat(AutoDecorator.isDecorated(decorated, Inventory.class.getMethod("describe", String.class))).isTrue();
        assertThat(AutoDecorator.isDecorated(decorated, Inventory.class.getMethod("slowLookup", String.class))).isFalse();
        assertThat(sink.entries()).isEmpty();
    }

    @Test
    void decorate_proxyObjectMembers() {
        Inventory decorated = decorator.decorate(Inventory.class, inventory, DecorationPolicy.defaults());

        assertThat(decorated).isEqualTo(decorated);
        assertThat(decorated).isNotEqualTo(inventory);
        assertThat(decorated.hashCode()).isEqualTo(System.identityHashCode(decorated));
        assertThat(decorated.toString()).isEqualTo("DecoratedInventory[FlakyInventory]");
        assertThat(AutoDecorator.isDecorated(decorated)).isTrue();
        assertThat(AutoDecorator.isDecorated(inventory)).isFalse();
    }

    @Test
    void decorate_rejectsConcreteType() {
        assertThatThrownBy(() -> decorator.decorate(FlakyInventory.class, inventory, DecorationPolicy.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // === Operation tables ===

    @Test
    void wrap_rebindsEveryCapabilityInPlace() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        OperationTable table = OperationTable.named("orders")
                .register("submit", args -> {
                    if (attempts.incrementAndGet() < 3) {
                        throw new IOException("queue full");
                    }
                    return "accepted " + args[0];
                })
                .register("cancel", args -> "cancelled");

        int decorated = decorator.wrap(table, retryThree());

        assertThat(decorated).isEqualTo(2);
        assertThat(table.operation("submit")).isInstanceOf(DecoratedOperation.class);
        assertThat(table.invoke("submit", "o-1")).isEqualTo("accepted o-1");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void wrap_twice_replacesDecorationInsteadOfNesting() {
        AtomicInteger attempts = new AtomicInteger();
        Operation submit = args -> {
            attempts.incrementAndGet();
            throw new IOException("queue full");
        };
        OperationTable table = OperationTable.named("orders").register("submit", submit);

        decorator.wrap(table, retryThree());
        decorator.wrap(table, retryThree());

        assertThatThrownBy(() -> table.invoke("submit")).isInstanceOf(IOException.class);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(((DecoratedOperation) table.operation("submit")).original()).isSameAs(submit);
        assertThat(AutoDecorator.isDecorated(table.operation("submit"))).isTrue();
    }

    @Test
    void wrap_readOnlyEntry_loggedAndSkippedSiblingsStillWrapped() throws Exception {
        OperationTable table = OperationTable.named("orders")
                .registerReadOnly("audit", args -> {
                    throw new IllegalStateException("audit log offline");
                })
                .register("submit", args -> {
                    throw new IllegalStateException("queue offline");
                });
        DecorationPolicy policy = DecorationPolicy.builder().fallback("degraded").build();

        int decorated = decorator.wrap(table, policy);

        assertThat(decorated).isEqualTo(1);
        assertThat(sink.messagesAt(LogLevel.WARN)).containsExactly(
                "Could not decorate orders.audit: Capability 'audit' is read-only");
        assertThat(table.invoke("submit")).isEqualTo("degraded");
        assertThatThrownBy(() -> table.invoke("audit")).hasMessage("audit log offline");
    }

    @Test
    void wrap_propertiesNeverDecorated() throws Exception {
        OperationTable table = OperationTable.named("queue")
                .property("depth", () -> {
                    throw new IllegalStateException("not connected");
                });

        int decorated = decorator.wrap(table, DecorationPolicy.builder().fallback(0).build());

        assertThat(decorated).isZero();
        assertThat(sink.at(LogLevel.WARN)).isEmpty();
        assertThatThrownBy(() -> table.invoke("depth")).isInstanceOf(IllegalStateException.class);
    }
}
