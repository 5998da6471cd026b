package com.restschema.serializers;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.restschema.common.status.StatusOr;
import com.restschema.errors.ConfigurationException;
import com.restschema.errors.FieldError;
import com.restschema.errors.ValidationException;
import com.restschema.fields.FieldDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Ordered set of fields defining a resource representation.
 *
 * <p>Field order fixes the key order of encoded representations and of {@link #describe()}.
 * Decoded object dictionaries are keyed by field source, not by field name.
 */
public final class Serializer {
  private final ImmutableMap<String, FieldDescriptor<?>> fields;
  private final ImmutableList<ObjectValidator> objectValidators;
  private final boolean forbidUnknown;

  private Serializer(Builder builder) {
    this.fields = ImmutableMap.copyOf(builder.fields);
    this.objectValidators = ImmutableList.copyOf(builder.objectValidators);
    this.forbidUnknown = builder.forbidUnknown;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Encodes an internal object, skipping write-only fields.
   *
   * @param instance the internal object (a map, record, bean or plain object)
   * @return representation keyed by field name, in declaration order
   */
  public Map<String, Object> encode(Object instance) {
    Objects.requireNonNull(instance, "instance");
    Map<String, Object> representation = new LinkedHashMap<>();
    for (FieldDescriptor<?> field : fields.values()) {
      if (field.isWriteOnly()) {
        continue;
      }
      representation.put(field.getName(), field.encode(field.read(instance)));
    }
    return representation;
  }

  /**
   * Decodes and validates a representation.
   *
   * <p>Absent keys are skipped. On a full decode ({@code partial == false}) an absent field
   * that is marked required is reported as {@code missing}; other absent fields are still
   * skipped.
   *
   * @param representation the decoded request body
   * @param partial whether this is a partial update
   * @return decoded values keyed by field source, in declaration order
   * @throws ValidationException listing every field-level error, or the object-level errors
   *     when all fields decoded
   */
  public Map<String, Object> decode(Map<String, ?> representation, boolean partial) {
    Objects.requireNonNull(representation, "representation");
    Map<String, Object> objectDict = new LinkedHashMap<>();
    List<FieldError> errors = new ArrayList<>();

    for (FieldDescriptor<?> field : fields.values()) {
      if (field.isReadOnly()) {
        continue;
      }
      String name = field.getName();
      if (!representation.containsKey(name)) {
        if (!partial && field.isRequired()) {
          errors.add(FieldError.of(name, "missing"));
        }
        continue;
      }
      StatusOr<Object> value = field.decode(representation.get(name));
      if (value.isNotOk()) {
        errors.add(FieldError.of(name, value.getStatus().getMessage()));
        continue;
      }
      objectDict.put(field.getSource(), value.getValue());
    }

    if (forbidUnknown) {
      for (String key : representation.keySet()) {
        FieldDescriptor<?> field = fields.get(key);
        if (field == null || field.isReadOnly()) {
          errors.add(FieldError.of(key, "forbidden"));
        }
      }
    }

    if (errors.isEmpty()) {
      for (ObjectValidator validator : objectValidators) {
        errors.addAll(validator.validate(objectDict, partial));
      }
    }
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }
    return objectDict;
  }

  /**
   * Writes a decoded object dictionary back onto an internal object through each field's
   * accessor. Keys with no matching writable field are ignored.
   */
  public void update(Object target, Map<String, ?> objectDict) {
    Objects.requireNonNull(target, "target");
    for (FieldDescriptor<?> field : fields.values()) {
      if (!field.isReadOnly() && objectDict.containsKey(field.getSource())) {
        field.update(target, objectDict.get(field.getSource()));
      }
    }
  }

  /** Field descriptions keyed by field name, in declaration order. */
  public Map<String, Object> describe() {
    Map<String, Object> description = new LinkedHashMap<>();
    fields.forEach((name, field) -> description.put(name, field.describe()));
    return description;
  }

  @Nullable
  public FieldDescriptor<?> getField(String name) {
    return fields.get(name);
  }

  public ImmutableList<FieldDescriptor<?>> fields() {
    return fields.values().asList();
  }

  public boolean isForbidUnknown() {
    return forbidUnknown;
  }

  /** Builder for {@link Serializer}. */
  public static final class Builder {
    private final Map<String, FieldDescriptor<?>> fields = new LinkedHashMap<>();
    private final List<String> duplicates = new ArrayList<>();
    private final List<ObjectValidator> objectValidators = new ArrayList<>();
    private boolean forbidUnknown;

    private Builder() {}

    public Builder field(FieldDescriptor<?> field) {
      Objects.requireNonNull(field, "field");
      if (fields.putIfAbsent(field.getName(), field) != null) {
        duplicates.add(field.getName());
      }
      return this;
    }

    /** Adds an object-level check; checks run in the order they were added. */
    public Builder validator(ObjectValidator validator) {
      objectValidators.add(Objects.requireNonNull(validator, "validator"));
      return this;
    }

    /** Reject representation keys that are undeclared or read-only. */
    public Builder forbidUnknown() {
      this.forbidUnknown = true;
      return this;
    }

    /**
     * Builds the serializer.
     *
     * @throws ConfigurationException if two fields share a name
     */
    public Serializer build() {
      if (!duplicates.isEmpty()) {
        throw new ConfigurationException("duplicate field names: " + duplicates);
      }
      return new Serializer(this);
    }
  }
}
