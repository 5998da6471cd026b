package com.restschema.fields;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * How a field reads and writes the attribute it is bound to on an internal object.
 */
public interface AttributeAccessor {

  /** Source name that binds a field to the whole object instead of one attribute. */
  String WHOLE_OBJECT = "*";

  /**
   * Reads the attribute named {@code source}.
   *
   * @return the attribute value, or null when the object has no such attribute
   */
  @Nullable
  Object read(Object instance, String source);

  /**
   * Writes the attribute named {@code source}.
   *
   * @throws IllegalArgumentException if the attribute cannot be written
   */
  void update(Object instance, String source, @Nullable Object value);

  /** Map keys first, then record components, getters and setters, then public fields. */
  static AttributeAccessor standard() {
    return StandardAttributeAccessor.INSTANCE;
  }

  /**
   * Fans a single list-valued field out over several attributes: reading yields the values of
   * {@code keys} in order, writing expects a list of the same length. The field's own source
   * is ignored.
   */
  static AttributeAccessor multiKey(String... keys) {
    ImmutableList<String> attributes = ImmutableList.copyOf(keys);
    if (attributes.isEmpty()) {
      throw new IllegalArgumentException("multiKey needs at least one key");
    }
    return new AttributeAccessor() {
      @Override
      public Object read(Object instance, String source) {
        List<Object> values = new ArrayList<>(attributes.size());
        for (String key : attributes) {
          values.add(standard().read(instance, key));
        }
        return values;
      }

      @Override
      public void update(Object instance, String source, Object value) {
        if (!(value instanceof List) || ((List<?>) value).size() != attributes.size()) {
          throw new IllegalArgumentException(
              "expected a list of " + attributes.size() + " values for " + attributes);
        }
        List<?> values = (List<?>) value;
        for (int i = 0; i < attributes.size(); i++) {
          standard().update(instance, attributes.get(i), values.get(i));
        }
      }
    };
  }
}
