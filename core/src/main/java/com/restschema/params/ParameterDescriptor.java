package com.restschema.params;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.restschema.common.status.Status;
import com.restschema.common.status.StatusOr;
import com.restschema.errors.ConfigurationException;
import com.restschema.validation.Validator;
import com.restschema.validation.Validators;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Describes one query string parameter: its coercion rule, multiplicity, default and
 * validation.
 *
 * <p>Descriptors are immutable and safe to share between concurrent requests.
 *
 * @param <T> the type a single raw value is coerced to
 */
public final class ParameterDescriptor<T> {
  private final String name;
  private final ParamType<T> type;
  private final String details;
  private final String label;
  private final boolean required;
  private final String defaultValue;
  private final boolean many;
  private final Container container;
  private final ImmutableList<Validator<? super T>> validators;
  private final ImmutableList<Validator<Object>> combinedValidators;
  private final boolean echo;

  private ParameterDescriptor(Builder<T> builder) {
    this.name = builder.name;
    this.type = builder.type;
    this.details = builder.details;
    this.label = builder.label;
    this.required = builder.required;
    this.defaultValue = builder.defaultValue;
    this.many = builder.many;
    this.container = builder.container == null ? Container.orderedList() : builder.container;
    this.validators = ImmutableList.copyOf(builder.validators);
    this.combinedValidators = ImmutableList.copyOf(builder.combinedValidators);
    this.echo = builder.echo;
  }

  public static <T> Builder<T> builder(String name, ParamType<T> type) {
    return new Builder<>(name, type);
  }

  /** Returns a builder pre-filled with this descriptor's configuration. */
  public Builder<T> toBuilder() {
    Builder<T> builder = new Builder<>(name, type)
        .details(details)
        .label(label)
        .required(required)
        .defaultValue(defaultValue)
        .many(many)
        .echo(echo);
    if (many) {
      builder.container(container);
    }
    builder.validators.addAll(validators);
    builder.combinedValidators.addAll(combinedValidators);
    return builder;
  }

  /**
   * Coerces and validates the raw values supplied for this parameter.
   *
   * <p>When the parameter is single-valued and several values were supplied, the last one is
   * used. Multi-valued parameters coerce every value in arrival order and combine the results
   * with the configured {@link Container}.
   *
   * @param rawValues raw values in arrival order, at least one
   * @return the value to store, or the first coercion or validation failure
   */
  public StatusOr<Object> coerce(List<String> rawValues) {
    if (rawValues.isEmpty()) {
      throw new IllegalArgumentException("no raw values for parameter " + name);
    }
    if (!many) {
      StatusOr<T> single = coerceOne(rawValues.get(rawValues.size() - 1));
      return single.flatMap(value -> validateCombined(value));
    }

    List<Object> coerced = new ArrayList<>(rawValues.size());
    for (String raw : rawValues) {
      StatusOr<T> value = coerceOne(raw);
      if (value.isNotOk()) {
        return StatusOr.ofStatus(value.getStatus());
      }
      coerced.add(value.getValue());
    }
    return validateCombined(container.combine(coerced));
  }

  private StatusOr<T> coerceOne(String raw) {
    StatusOr<T> value = type.parse(raw);
    if (value.isNotOk()) {
      return value;
    }
    Status status = Validators.runChain(validators, value.getValue());
    return status.isOk() ? value : StatusOr.ofStatus(status);
  }

  private StatusOr<Object> validateCombined(Object value) {
    Status status = Validators.runChain(combinedValidators, value);
    return status.isOk() ? StatusOr.ofValue(value) : StatusOr.ofStatus(status);
  }

  /**
   * Describes this parameter for resource self-documentation.
   *
   * @return ordered description map
   */
  public Map<String, Object> describe() {
    Map<String, Object> description = new LinkedHashMap<>();
    description.put("details", details);
    description.put("label", label);
    description.put("required", required);
    description.put("default", defaultValue);
    description.put("many", many);
    if (many) {
      description.put("container", container.name());
    }
    description.put("type", type.typeName());
    description.put("spec", type.spec() == null ? null : type.spec().describe());
    return description;
  }

  @Nonnull
  public String getName() {
    return name;
  }

  public ParamType<T> getType() {
    return type;
  }

  public String getDetails() {
    return details;
  }

  @Nullable
  public String getLabel() {
    return label;
  }

  public boolean isRequired() {
    return required;
  }

  @Nullable
  public String getDefaultValue() {
    return defaultValue;
  }

  public boolean isMany() {
    return many;
  }

  public Container getContainer() {
    return container;
  }

  /** Whether the resolved value may be echoed back to clients in response meta. */
  public boolean isEcho() {
    return echo;
  }

  @Override
  public String toString() {
    return "ParameterDescriptor{" + name + ": " + type.typeName() + (many ? "[]" : "") + "}";
  }

  /**
   * Builder for {@link ParameterDescriptor}.
   *
   * @param <T> the coerced type
   */
  public static final class Builder<T> {
    private final String name;
    private final ParamType<T> type;
    private String details = "";
    private String label;
    private boolean required;
    private String defaultValue;
    private boolean many;
    private Container container;
    private final List<Validator<? super T>> validators = new ArrayList<>();
    private final List<Validator<Object>> combinedValidators = new ArrayList<>();
    private boolean echo = true;

    private Builder(String name, ParamType<T> type) {
      this.name = name;
      this.type = Objects.requireNonNull(type, "type");
    }

    /** Verbose description shown to API users. */
    public Builder<T> details(String details) {
      this.details = Strings.nullToEmpty(details);
      return this;
    }

    public Builder<T> label(@Nullable String label) {
      this.label = label;
      return this;
    }

    public Builder<T> required(boolean required) {
      this.required = required;
      return this;
    }

    /** Raw value used when the parameter is absent; parsed like any client value. */
    public Builder<T> defaultValue(@Nullable String defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder<T> many(boolean many) {
      this.many = many;
      return this;
    }

    /** Combine strategy for multi-valued parameters, defaults to an ordered list. */
    public Builder<T> container(Container container) {
      this.container = Objects.requireNonNull(container, "container");
      return this;
    }

    /** Validator applied to every coerced value before it is combined. */
    public Builder<T> validator(Validator<? super T> validator) {
      validators.add(Objects.requireNonNull(validator, "validator"));
      return this;
    }

    /** Validator applied to the final stored value, after any combining. */
    public Builder<T> combinedValidator(Validator<Object> validator) {
      combinedValidators.add(Objects.requireNonNull(validator, "validator"));
      return this;
    }

    /** Set to false to keep the value out of echoed response meta. */
    public Builder<T> echo(boolean echo) {
      this.echo = echo;
      return this;
    }

    /**
     * Builds the descriptor.
     *
     * @throws ConfigurationException on an empty name, a required parameter with a default, or
     *     a container on a single-valued parameter
     */
    public ParameterDescriptor<T> build() {
      if (Strings.isNullOrEmpty(name)) {
        throw new ConfigurationException("parameter name must not be empty");
      }
      if (required && defaultValue != null) {
        throw new ConfigurationException(String.format(
            "parameter '%s' (required=true, default='%s'): "
                + "initialization with both required and default makes no sense",
            name, defaultValue));
      }
      if (!many && container != null) {
        throw new ConfigurationException(
            "parameter '" + name + "' sets a container but is not multi-valued");
      }
      return new ParameterDescriptor<>(this);
    }
  }
}
