package org.javai.resilience.decorate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.resilience.ThrowingSupplier;

/**
 * An explicit, named set of operations that {@link AutoDecorator#wrap} can rebind in place.
 *
 * <p>Owners register the operations eligible for decoration when they build the table.
 * Entries may be marked read-only, in which case rebinding fails, or registered as
 * properties, which are never decorated.
 *
 * <pre>{@code
 * OperationTable inventory = OperationTable.named("inventory")
 *     .register("reserve", args -> stock.reserve((String) args[0], (Integer) args[1]))
 *     .registerReadOnly("audit", args -> stock.audit())
 *     .property("size", stock::size);
 *
 * decorator.wrap(inventory, DecorationPolicy.builder().retryAttempts(3).build());
 * inventory.invoke("reserve", "sku-1", 2);
 * }</pre>
 */
public final class OperationTable {

    private record Entry(Operation operation, boolean readOnly, boolean property) {
    }

    private final String name;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private OperationTable(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public static OperationTable named(String name) {
        return new OperationTable(name);
    }

    public String name() {
        return name;
    }

    public synchronized OperationTable register(String capability, Operation operation) {
        return put(capability, operation, false, false);
    }

    /**
     * Registers an operation that cannot be rebound after registration.
     */
    public synchronized OperationTable registerReadOnly(String capability, Operation operation) {
        return put(capability, operation, true, false);
    }

    /**
     * Registers a computed value. Properties are invocable but never decorated.
     */
    public synchronized OperationTable property(String capability, ThrowingSupplier<?, ? extends Exception> accessor) {
        Objects.requireNonNull(accessor, "accessor must not be null");
        return put(capability, args -> accessor.get(), true, true);
    }

    private OperationTable put(String capability, Operation operation, boolean readOnly, boolean property) {
        Objects.requireNonNull(capability, "capability must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        if (capability.isBlank()) {
            throw new IllegalArgumentException("capability must not be blank");
        }
        if (entries.containsKey(capability)) {
            throw new IllegalArgumentException("Capability '" + capability + "' is already registered in " + name);
        }
        entries.put(capability, new Entry(operation, readOnly, property));
        return this;
    }

    /**
     * Replaces the operation bound to {@code capability}.
     *
     * @throws ReadOnlyCapabilityException if the entry is read-only or a property
     * @throws IllegalArgumentException if no such capability is registered
     */
    public synchronized void rebind(String capability, Operation operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        Entry entry = entry(capability);
        if (entry.readOnly()) {
            throw new ReadOnlyCapabilityException(capability);
        }
        entries.put(capability, new Entry(operation, false, false));
    }

    public synchronized Operation operation(String capability) {
        return entry(capability).operation();
    }

    /**
     * Invokes the operation currently bound to {@code capability}.
     */
    public Object invoke(String capability, Object... args) throws Exception {
        return operation(capability).invoke(args);
    }

    public synchronized boolean contains(String capability) {
        return entries.containsKey(capability);
    }

    public synchronized boolean isReadOnly(String capability) {
        return entry(capability).readOnly();
    }

    public synchronized boolean isProperty(String capability) {
        return entry(capability).property();
    }

    /**
     * All registered names, properties included, in registration order.
     */
    public synchronized List<String> names() {
        return List.copyOf(entries.keySet());
    }

    private Entry entry(String capability) {
        Entry entry = entries.get(capability);
        if (entry == null) {
            throw new IllegalArgumentException("No capability '" + capability + "' in " + name);
        }
        return entry;
    }

    @Override
    public String toString() {
        return "OperationTable[" + name + ", " + names() + "]";
    }
}
