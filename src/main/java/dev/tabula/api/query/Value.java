/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api.query;

import dev.tabula.api.schema.ValueCodec;

/**
 * A constant operand. Rendered as a {@code ?} placeholder and bound in emission order, or inlined
 * as a literal by unparametrized dumps.
 *
 * @param value constant, may be {@code null}
 * @param codec codec used to bind it
 * @param <R> value type
 */
public record Value<R>(R value, ValueCodec<R> codec) implements Expression<R> {}
