package com.floorplan.positioning.engine;

import com.floorplan.positioning.algorithm.TransformType;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a transform query: a value on success, otherwise the reason there is none.
 *
 * @param status Query outcome
 * @param value Derived value, null unless the status is {@link TransformStatus#SUCCESS}
 * @param transformType Transform the value was derived with, when one was involved
 * @param <T> Value type
 */
public record TransformResult<T>(TransformStatus status, T value, TransformType transformType) {

  public TransformResult {
    Objects.requireNonNull(status, "status must not be null");
    if (status == TransformStatus.SUCCESS && value == null) {
      throw new IllegalArgumentException("A successful result must carry a value");
    }
    if (status != TransformStatus.SUCCESS && value != null) {
      throw new IllegalArgumentException("Only a successful result may carry a value");
    }
  }

  public static <T> TransformResult<T> success(T value) {
    return new TransformResult<>(TransformStatus.SUCCESS, value, null);
  }

  public static <T> TransformResult<T> success(T value, TransformType transformType) {
    return new TransformResult<>(TransformStatus.SUCCESS, value, transformType);
  }

  public static <T> TransformResult<T> notCalibrated() {
    return new TransformResult<>(TransformStatus.NOT_CALIBRATED, null, null);
  }

  public static <T> TransformResult<T> degenerate() {
    return new TransformResult<>(TransformStatus.DEGENERATE, null, null);
  }

  public boolean isSuccess() {
    return status == TransformStatus.SUCCESS;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  public T orElse(T other) {
    return isSuccess() ? value : other;
  }

  /** Maps the value of a successful result, keeping status and transform type otherwise. */
  public <R> TransformResult<R> map(Function<? super T, ? extends R> mapper) {
    if (!isSuccess()) {
      return new TransformResult<>(status, null, transformType);
    }
    return new TransformResult<>(status, mapper.apply(value), transformType);
  }
}
