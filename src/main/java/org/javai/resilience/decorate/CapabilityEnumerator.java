package org.javai.resilience.decorate;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Lists the operations of a target that are eligible for decoration.
 *
 * <p>Eligibility is declared, not discovered: a target either registers its operations
 * in an {@link OperationTable}, or implements a Java interface whose methods are its
 * capabilities. In both cases private-named members and property accessors are left out.
 * Interface capabilities also exclude static, synthetic and bridge methods and the
 * members {@code Object} declares.
 *
 * <p>Order is stable: registration order for tables, and name then parameter types for
 * interfaces.
 */
public final class CapabilityEnumerator {

    static final Comparator<Method> METHOD_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparing(CapabilityEnumerator::parameterSignature);

    private CapabilityEnumerator() {
        // Utility class
    }

    /**
     * The decoratable operations of a table, in registration order.
     */
    public static List<CapabilityDescriptor> list(OperationTable table) {
        Objects.requireNonNull(table, "table must not be null");
        List<CapabilityDescriptor> capabilities = new ArrayList<>();
        for (String name : table.names()) {
            if (isPrivateName(name) || table.isProperty(name)) {
                continue;
            }
            capabilities.add(new CapabilityDescriptor(name, Optional.empty(), table.operation(name)));
        }
        return List.copyOf(capabilities);
    }

    /**
     * The decoratable operations {@code capabilityType} declares, bound to {@code target}.
     *
     * @throws IllegalArgumentException if {@code capabilityType} is not an interface
     */
    public static <T> List<CapabilityDescriptor> list(Class<T> capabilityType, T target) {
        Objects.requireNonNull(target, "target must not be null");
        return methods(capabilityType).stream()
                .map(method -> new CapabilityDescriptor(method.getName(), Optional.of(method), bind(method, target)))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * The capability methods of an interface, in stable order.
     */
    public static List<Method> methods(Class<?> capabilityType) {
        Objects.requireNonNull(capabilityType, "capabilityType must not be null");
        if (!capabilityType.isInterface()) {
            throw new IllegalArgumentException(capabilityType.getName() + " is not an interface");
        }
        return Arrays.stream(capabilityType.getMethods())
                .filter(CapabilityEnumerator::isCapability)
                .sorted(METHOD_ORDER)
                .collect(Collectors.toUnmodifiableList());
    }

    static boolean isCapability(Method method) {
        int modifiers = method.getModifiers();
        if (!Modifier.isPublic(modifiers) || Modifier.isStatic(modifiers)) {
            return false;
        }
        if (method.isSynthetic() || method.isBridge()) {
            return false;
        }
        return !isPrivateName(method.getName())
                && !isObjectMember(method)
                && !isPropertyAccessor(method);
    }

    /**
     * Names starting with {@code _} or {@code $}, or containing {@code $}, are private by convention.
     */
    public static boolean isPrivateName(String name) {
        return name.startsWith("_") || name.indexOf('$') >= 0;
    }

    /**
     * A JavaBeans-style accessor: {@code getX()} returning a value, or {@code isX()} returning boolean.
     */
    public static boolean isPropertyAccessor(Method method) {
        if (method.getParameterCount() != 0) {
            return false;
        }
        String name = method.getName();
        Class<?> type = method.getReturnType();
        if (hasPropertySuffix(name, "get")) {
            return type != void.class;
        }
        if (hasPropertySuffix(name, "is")) {
            return type == boolean.class || type == Boolean.class;
        }
        return false;
    }

    private static boolean hasPropertySuffix(String name, String prefix) {
        return name.length() > prefix.length()
                && name.startsWith(prefix)
                && Character.isUpperCase(name.charAt(prefix.length()));
    }

    private static boolean isObjectMember(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static String parameterSignature(Method method) {
        return Arrays.stream(method.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.joining(","));
    }

    static Operation bind(Method method, Object target) {
        method.trySetAccessible();
        return args -> invoke(method, target, args);
    }

    /**
     * Invokes {@code method} reflectively and rethrows the target's own fault.
     */
    static Object invoke(Method method, Object target, Object[] args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getTargetException();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot invoke " + method, e);
        }
    }
}
