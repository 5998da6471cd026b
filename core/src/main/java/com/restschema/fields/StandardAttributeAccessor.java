package com.restschema.fields;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Map;

/**
 * Default attribute access: map keys, record components, JavaBean accessors and public fields.
 */
final class StandardAttributeAccessor implements AttributeAccessor {
  static final StandardAttributeAccessor INSTANCE = new StandardAttributeAccessor();

  private StandardAttributeAccessor() {}

  @Override
  public Object read(Object instance, String source) {
    if (WHOLE_OBJECT.equals(source)) {
      return instance;
    }
    if (instance instanceof Map) {
      return ((Map<?, ?>) instance).get(source);
    }

    Class<?> type = instance.getClass();
    if (type.isRecord()) {
      for (RecordComponent component : type.getRecordComponents()) {
        if (component.getName().equals(source)) {
          return invoke(component.getAccessor(), instance);
        }
      }
      return null;
    }

    String suffix = capitalize(source);
    for (String getter : new String[] {"get" + suffix, "is" + suffix}) {
      Method method = findMethod(type, getter, 0);
      if (method != null) {
        return invoke(method, instance);
      }
    }

    Field field = findPublicField(type, source);
    if (field != null) {
      try {
        return field.get(instance);
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("cannot read field " + source + " of " + type.getName(), e);
      }
    }
    return null;
  }

  @Override
  @SuppressWarnings("unchecked")
  public void update(Object instance, String source, Object value) {
    if (WHOLE_OBJECT.equals(source)) {
      if (instance instanceof Map && value instanceof Map) {
        ((Map<Object, Object>) instance).putAll((Map<?, ?>) value);
        return;
      }
      throw new IllegalArgumentException("whole-object updates need a map instance and a map value");
    }
    if (instance instanceof Map) {
      ((Map<Object, Object>) instance).put(source, value);
      return;
    }

    Class<?> type = instance.getClass();
    if (type.isRecord()) {
      throw new IllegalArgumentException(
          "cannot update attribute " + source + " of immutable record " + type.getName());
    }

    Method setter = findMethod(type, "set" + capitalize(source), 1);
    if (setter != null) {
      invoke(setter, instance, value);
      return;
    }

    Field field = findPublicField(type, source);
    if (field != null && !Modifier.isFinal(field.getModifiers())) {
      try {
        field.set(instance, value);
        return;
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("cannot write field " + source + " of " + type.getName(), e);
      }
    }
    throw new IllegalArgumentException("no writable attribute " + source + " on " + type.getName());
  }

  private static Method findMethod(Class<?> type, String name, int parameterCount) {
    for (Method method : type.getMethods()) {
      if (method.getName().equals(name)
          && method.getParameterCount() == parameterCount
          && !Modifier.isStatic(method.getModifiers())) {
        return method;
      }
    }
    return null;
  }

  private static Field findPublicField(Class<?> type, String name) {
    try {
      Field field = type.getField(name);
      if (Modifier.isStatic(field.getModifiers())) {
        return null;
      }
      field.trySetAccessible();
      return field;
    } catch (NoSuchFieldException e) {
      return null;
    }
  }

  private static Object invoke(Method method, Object instance, Object... args) {
    try {
      method.trySetAccessible();
      return method.invoke(instance, args);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("cannot access " + method, e);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("accessor " + method + " failed", cause);
    }
  }

  private static String capitalize(String source) {
    if (source.isEmpty()) {
      return source;
    }
    return Character.toUpperCase(source.charAt(0)) + source.substring(1);
  }
}
