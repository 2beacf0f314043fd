package io.lighting.stencil.template;

import io.lighting.stencil.TemplateRuntimeException;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@code base.name} and {@code base[key]}.
 * <p>
 * Two capabilities are tried in order: indexed access (map keys, list/array/text positions),
 * then named access (getter, {@code is}-getter, public no-arg method, field). The first one that
 * yields a value wins; when neither does the lookup fails.
 */
final class AttributeResolver {
    static final Object MISSING = new Object();

    private static final List<AttributeAccess> ACCESSES = List.of(new IndexAccess(), new PropertyAccess());

    private AttributeResolver() {
    }

    static Object resolve(Object target, Object key) {
        if (target == null) {
            throw new TemplateRuntimeException("Cannot read attribute '" + key + "' of null");
        }
        for (AttributeAccess access : ACCESSES) {
            Object value = access.lookup(target, key);
            if (value != MISSING) {
                return value;
            }
        }
        throw new TemplateRuntimeException(
            "Unknown attribute '" + key + "' on " + target.getClass().getName()
        );
    }

    interface AttributeAccess {
        /**
         * Returns the value or {@link #MISSING} when this capability cannot supply it.
         */
        Object lookup(Object target, Object key);
    }

    static final class IndexAccess implements AttributeAccess {
        @Override
        public Object lookup(Object target, Object key) {
            if (target instanceof Map<?, ?> map) {
                return lookupKey(map, key);
            }
            if (!(key instanceof Number number) || !Values.isIntegral(number)) {
                return MISSING;
            }
            if (target instanceof List<?> list) {
                int index = position(number, list.size());
                return index < 0 ? MISSING : list.get(index);
            }
            if (target.getClass().isArray()) {
                int index = position(number, Array.getLength(target));
                return index < 0 ? MISSING : Array.get(target, index);
            }
            if (target instanceof CharSequence sequence) {
                int index = position(number, sequence.length());
                return index < 0 ? MISSING : String.valueOf(sequence.charAt(index));
            }
            return MISSING;
        }

        private Object lookupKey(Map<?, ?> map, Object key) {
            if (map.containsKey(key)) {
                return map.get(key);
            }
            if (key instanceof Long number && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                Integer narrowed = number.intValue();
                if (map.containsKey(narrowed)) {
                    return map.get(narrowed);
                }
            }
            return MISSING;
        }

        // negative positions count from the end
        private int position(Number number, int size) {
            long index = number.longValue();
            if (index < 0) {
                index += size;
            }
            return index >= 0 && index < size ? (int) index : -1;
        }
    }

    static final class PropertyAccess implements AttributeAccess {
        @Override
        public Object lookup(Object target, Object key) {
            if (!(key instanceof CharSequence sequence) || sequence.length() == 0) {
                return MISSING;
            }
            if (isReflective(target.getClass())) {
                return MISSING;
            }
            String name = sequence.toString();
            Method accessor = findAccessor(target.getClass(), name);
            if (accessor != null && !isReflective(accessor.getReturnType())) {
                return invoke(target, accessor, name);
            }
            Field field = findField(target.getClass(), name);
            if (field != null && !isReflective(field.getType())) {
                try {
                    return field.get(target);
                } catch (IllegalAccessException ex) {
                    throw new TemplateRuntimeException("Failed to read field: " + name, ex);
                }
            }
            return MISSING;
        }

        // class objects, class loaders and modules are never reachable from a template
        private static boolean isReflective(Class<?> type) {
            return type == Class.class
                || ClassLoader.class.isAssignableFrom(type)
                || type == Module.class
                || type == Package.class;
        }

        private Object invoke(Object target, Method method, String name) {
            try {
                return method.invoke(target);
            } catch (InvocationTargetException ex) {
                throw new TemplateRuntimeException("Failed to read property: " + name, ex.getCause());
            } catch (IllegalAccessException ex) {
                if (method.trySetAccessible()) {
                    return invoke(target, method, name);
                }
                throw new TemplateRuntimeException("Failed to read property: " + name, ex);
            }
        }

        private Method findAccessor(Class<?> type, String name) {
            if ("class".equals(name) || "getClass".equals(name)) {
                return null;
            }
            String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
            Method getter = findInvokableMethod(type, "get" + capitalized);
            if (getter != null) {
                return getter;
            }
            Method predicate = findInvokableMethod(type, "is" + capitalized);
            if (predicate != null
                && (predicate.getReturnType() == boolean.class || predicate.getReturnType() == Boolean.class)) {
                return predicate;
            }
            return findInvokableMethod(type, name);
        }

        private Field findField(Class<?> type, String name) {
            for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
                try {
                    Field field = current.getDeclaredField(name);
                    if (!Modifier.isStatic(field.getModifiers()) && field.trySetAccessible()) {
                        return field;
                    }
                } catch (NoSuchFieldException ignored) {
                    // continue with the superclass
                }
            }
            return null;
        }

        private Method findInvokableMethod(Class<?> type, String methodName) {
            Method direct = findPublicMethod(type, methodName);
            if (direct != null && Modifier.isPublic(direct.getDeclaringClass().getModifiers())) {
                return direct;
            }
            Method interfaceMethod = findPublicInterfaceMethod(type, methodName);
            if (interfaceMethod != null) {
                return interfaceMethod;
            }
            for (Class<?> current = type.getSuperclass(); current != null; current = current.getSuperclass()) {
                Method inherited = findPublicMethod(current, methodName);
                if (inherited != null && Modifier.isPublic(inherited.getDeclaringClass().getModifiers())) {
                    return inherited;
                }
                Method inheritedInterface = findPublicInterfaceMethod(current, methodName);
                if (inheritedInterface != null) {
                    return inheritedInterface;
                }
            }
            if (direct != null && direct.trySetAccessible()) {
                return direct;
            }
            return null;
        }

        private Method findPublicMethod(Class<?> type, String methodName) {
            try {
                Method method = type.getMethod(methodName);
                if (method.getReturnType() == void.class || Modifier.isStatic(method.getModifiers())) {
                    return null;
                }
                return method;
            } catch (NoSuchMethodException ignored) {
                return null;
            }
        }

        private Method findPublicInterfaceMethod(Class<?> type, String methodName) {
            for (Class<?> iface : type.getInterfaces()) {
                if (Modifier.isPublic(iface.getModifiers())) {
                    Method method = findPublicMethod(iface, methodName);
                    if (method != null) {
                        return method;
                    }
                }
                Method nested = findPublicInterfaceMethod(iface, methodName);
                if (nested != null) {
                    return nested;
                }
            }
            return null;
        }
    }
}
