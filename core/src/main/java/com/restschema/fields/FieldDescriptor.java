package com.restschema.fields;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.restschema.common.status.Status;
import com.restschema.common.status.StatusOr;
import com.restschema.errors.ConfigurationException;
import com.restschema.validation.Validator;
import com.restschema.validation.Validators;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Describes one representation field: the attribute it is bound to, how its value is converted
 * in each direction and how it is validated on the way in.
 *
 * <p>Validators run only when decoding; encoding trusts internal values.
 *
 * @param <I> the internal type of a single value
 */
public final class FieldDescriptor<I> {
  private final String name;
  private final FieldType<I> type;
  private final String details;
  private final String label;
  private final String source;
  private final boolean many;
  private final boolean readOnly;
  private final boolean writeOnly;
  private final boolean required;
  private final boolean nullable;
  private final ImmutableList<Validator<? super I>> validators;
  private final AttributeAccessor accessor;

  private FieldDescriptor(Builder<I> builder) {
    this.name = builder.name;
    this.type = builder.type;
    this.details = builder.details;
    this.label = builder.label;
    this.source = builder.source == null ? builder.name : builder.source;
    this.many = builder.many;
    this.readOnly = builder.readOnly;
    this.writeOnly = builder.writeOnly;
    this.required = builder.required;
    this.nullable = builder.nullable;
    this.validators = ImmutableList.copyOf(builder.validators);
    this.accessor = builder.accessor;
  }

  public static <I> Builder<I> builder(String name, FieldType<I> type) {
    return new Builder<>(name, type);
  }

  /**
   * Converts a representation value to its internal form and validates it. Multi-valued
   * fields convert each element of a list, keeping order and count.
   *
   * @param raw the representation value
   * @return the internal value, or the first failure
   */
  public StatusOr<Object> decode(@Nullable Object raw) {
    if (!many) {
      return decodeOne(raw).map(value -> (Object) value);
    }
    if (raw == null) {
      return nullable ? StatusOr.ofValue(null) : StatusOr.invalid("value must not be null");
    }
    if (!(raw instanceof List)) {
      return StatusOr.invalid(raw + " is not a list");
    }
    List<?> elements = (List<?>) raw;
    List<Object> decoded = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      StatusOr<I> element = decodeOne(elements.get(i));
      if (element.isNotOk()) {
        return StatusOr.invalid("[" + i + "] " + element.getStatus().getMessage());
      }
      decoded.add(element.getValue());
    }
    return StatusOr.ofValue(Collections.unmodifiableList(decoded));
  }

  private StatusOr<I> decodeOne(@Nullable Object raw) {
    if (raw == null) {
      return nullable ? StatusOr.ofValue(null) : StatusOr.invalid("value must not be null");
    }
    StatusOr<I> value = type.fromRepresentation(raw);
    if (value.isNotOk()) {
      return value;
    }
    Status status = Validators.runChain(validators, value.getValue());
    return status.isOk() ? value : StatusOr.ofStatus(status);
  }

  /**
   * Converts an internal value to its representation. Null stays null, or becomes an empty list
   * for multi-valued fields. Multi-valued fields accept any iterable or array.
   *
   * @param internal the internal value
   * @return the representation value
   */
  @Nullable
  public Object encode(@Nullable Object internal) {
    if (internal == null) {
      return many ? new ArrayList<>() : null;
    }
    if (!many) {
      return encodeOne(internal);
    }
    List<Object> encoded = new ArrayList<>();
    if (internal.getClass().isArray()) {
      for (int i = 0; i < Array.getLength(internal); i++) {
        encoded.add(encodeOne(Array.get(internal, i)));
      }
    } else if (internal instanceof Iterable) {
      for (Object element : (Iterable<?>) internal) {
        encoded.add(encodeOne(element));
      }
    } else {
      throw new IllegalArgumentException(
          "field '" + name + "' is multi-valued but " + internal.getClass().getName() + " is not iterable");
    }
    return encoded;
  }

  @SuppressWarnings("unchecked")
  private Object encodeOne(@Nullable Object element) {
    return element == null ? null : type.toRepresentation((I) element);
  }

  /** Reads this field's attribute from an internal object. */
  @Nullable
  public Object read(Object instance) {
    return accessor.read(instance, source);
  }

  /** Writes this field's attribute on an internal object. */
  public void update(Object instance, @Nullable Object value) {
    accessor.update(instance, source, value);
  }

  /**
   * Describes this field for resource self-documentation.
   *
   * @return ordered description map
   */
  public Map<String, Object> describe() {
    Map<String, Object> description = new LinkedHashMap<>();
    description.put("details", details);
    description.put("label", label);
    description.put("type", many ? "list of " + type.typeName() : type.typeName());
    description.put("spec", type.spec() == null ? null : type.spec().describe());
    description.put("read_only", readOnly);
    description.put("write_only", writeOnly);
    return description;
  }

  @Nonnull
  public String getName() {
    return name;
  }

  public FieldType<I> getType() {
    return type;
  }

  public String getDetails() {
    return details;
  }

  @Nullable
  public String getLabel() {
    return label;
  }

  /** Attribute or key name on the internal object; the field name unless configured. */
  public String getSource() {
    return source;
  }

  public boolean isMany() {
    return many;
  }

  /** Read-only fields are encoded but never decoded. */
  public boolean isReadOnly() {
    return readOnly;
  }

  /** Write-only fields are decoded but never encoded. */
  public boolean isWriteOnly() {
    return writeOnly;
  }

  /** Required fields must be present in non-partial decodes. */
  public boolean isRequired() {
    return required;
  }

  public AttributeAccessor getAccessor() {
    return accessor;
  }

  @Override
  public String toString() {
    return "FieldDescriptor{" + name + " <- " + source + ": " + type.typeName() + (many ? "[]" : "") + "}";
  }

  /**
   * Builder for {@link FieldDescriptor}.
   *
   * @param <I> the internal type
   */
  public static final class Builder<I> {
    private final String name;
    private final FieldType<I> type;
    private String details = "";
    private String label;
    private String source;
    private boolean many;
    private boolean readOnly;
    private boolean writeOnly;
    private boolean required;
    private boolean nullable;
    private final List<Validator<? super I>> validators = new ArrayList<>();
    private AttributeAccessor accessor = AttributeAccessor.standard();

    private Builder(String name, FieldType<I> type) {
      this.name = name;
      this.type = Objects.requireNonNull(type, "type");
    }

    public Builder<I> details(String details) {
      this.details = Strings.nullToEmpty(details);
      return this;
    }

    public Builder<I> label(@Nullable String label) {
      this.label = label;
      return this;
    }

    /** Attribute name on the internal object, or {@code "*"} for the whole object. */
    public Builder<I> source(String source) {
      this.source = source;
      return this;
    }

    public Builder<I> many(boolean many) {
      this.many = many;
      return this;
    }

    public Builder<I> readOnly(boolean readOnly) {
      this.readOnly = readOnly;
      return this;
    }

    public Builder<I> writeOnly(boolean writeOnly) {
      this.writeOnly = writeOnly;
      return this;
    }

    public Builder<I> required(boolean required) {
      this.required = required;
      return this;
    }

    /** Accept JSON null as a value; off by default. */
    public Builder<I> nullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    public Builder<I> validator(Validator<? super I> validator) {
      validators.add(Objects.requireNonNull(validator, "validator"));
      return this;
    }

    public Builder<I> accessor(AttributeAccessor accessor) {
      this.accessor = Objects.requireNonNull(accessor, "accessor");
      return this;
    }

    /**
     * Builds the descriptor.
     *
     * @throws ConfigurationException on an empty name or source, or a field that is both
     *     read-only and write-only
     */
    public FieldDescriptor<I> build() {
      if (Strings.isNullOrEmpty(name)) {
        throw new ConfigurationException("field name must not be empty");
      }
      if (source != null && source.isEmpty()) {
        throw new ConfigurationException("field '" + name + "' has an empty source");
      }
      if (readOnly && writeOnly) {
        throw new ConfigurationException(
            "field '" + name + "' cannot be both read-only and write-only");
      }
      if (readOnly && required) {
        throw new ConfigurationException(
            "field '" + name + "' is read-only and can never be required on input");
      }
      return new FieldDescriptor<>(this);
    }
  }
}
