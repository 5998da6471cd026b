/**
 * Status values used by coercion rules and validators.
 *
 * <p>Expected failures (a query string value that is not a number, a field that is out of range)
 * are reported as values, not exceptions:
 *
 * <ul>
 *   <li>{@link com.restschema.common.status.StatusCode} - the failure kind and its HTTP status</li>
 *   <li>{@link com.restschema.common.status.Status} - a code plus a client-facing message</li>
 *   <li>{@link com.restschema.common.status.StatusOr} - a coerced value or the status explaining
 *       why there is none</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;Integer&gt; age = StatusOr.parsing("3", Integer::valueOf);
 * if (age.isNotOk()) {
 *     errors.add(FieldError.of("age", age.getStatus().getMessage()));
 * }
 * </pre>
 *
 * <p>The dispatcher collects these statuses across a whole request and only then raises a
 * single aggregate exception.
 */
package com.restschema.common.status;
