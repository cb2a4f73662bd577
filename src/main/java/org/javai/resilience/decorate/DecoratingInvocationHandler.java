package org.javai.resilience.decorate;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routes proxy calls to decorated capabilities, passing everything else to the target.
 */
final class DecoratingInvocationHandler implements InvocationHandler {

    private static final Object[] NO_ARGS = new Object[0];

    private static final Map<Class<?>, Object> ZERO_VALUES = Map.of(
            boolean.class, false,
            byte.class, (byte) 0,
            short.class, (short) 0,
            char.class, '\0',
            int.class, 0,
            long.class, 0L,
            float.class, 0.0f,
            double.class, 0.0d
    );

    private final Class<?> capabilityType;
    private final Object target;
    private final Map<Method, Operation> capabilities;
    private final Map<Method, Operation> passThrough;

    DecoratingInvocationHandler(Class<?> capabilityType, Object target, Map<Method, Operation> capabilities) {
        this.capabilityType = Objects.requireNonNull(capabilityType, "capabilityType must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.capabilities = Map.copyOf(capabilities);
        this.passThrough = bindAll(capabilityType, target);
    }

    // Bound up front so undecorated methods of non-public interfaces stay callable
    private static Map<Method, Operation> bindAll(Class<?> capabilityType, Object target) {
        Map<Method, Operation> bound = new HashMap<>();
        for (Method method : capabilityType.getMethods()) {
            bound.put(method, CapabilityEnumerator.bind(method, target));
        }
        return Map.copyOf(bound);
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        Object[] arguments = args == null ? NO_ARGS : args;
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMember(proxy, method, arguments);
        }
        Operation operation = capabilities.get(method);
        if (operation == null) {
            operation = passThrough.get(method);
        }
        Object result = operation != null
                ? operation.invoke(arguments)
                : CapabilityEnumerator.invoke(method, target, arguments);
        return adapt(method.getReturnType(), result);
    }

    private Object invokeObjectMember(Object proxy, Method method, Object[] arguments) {
        return switch (method.getName()) {
            case "equals" -> proxy == arguments[0];
            case "hashCode" -> System.identityHashCode(proxy);
            default -> "Decorated" + capabilityType.getSimpleName() + "[" + target + "]";
        };
    }

    static Object adapt(Class<?> returnType, Object result) {
        if (result == null && returnType.isPrimitive() && returnType != void.class) {
            return ZERO_VALUES.get(returnType);
        }
        return result;
    }

    /**
     * Whether a fallback can be returned from a method with this return type.
     */
    static boolean accepts(Class<?> returnType, Object fallback) {
        if (fallback == null || returnType == void.class) {
            return true;
        }
        Class<?> boxed = returnType.isPrimitive() ? ZERO_VALUES.get(returnType).getClass() : returnType;
        return boxed.isInstance(fallback);
    }

    Object target() {
        return target;
    }

    boolean decorates(Method method) {
        return capabilities.containsKey(method);
    }
}
