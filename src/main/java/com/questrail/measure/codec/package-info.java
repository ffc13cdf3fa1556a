/**
 * Constraints Codec
 * =============================================================================
 *
 * <p>Bit-level packing of layout constraints into a single {@code long}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Constraints (api)
 *        → ConstraintAlgebra (core), on ConstraintBounds
 *        → ConstraintsCodec.encode / decode
 *        → SchemeSelector → PackingScheme
 * </pre>
 *
 * <p>This layer is strictly:</p>
 * <ul>
 *   <li>allocation-free apart from the decoded record</li>
 *   <li>deterministic</li>
 *   <li>unaware of layout semantics beyond min/max ordering</li>
 * </ul>
 *
 * <p>The packed word is an in-memory representation only. It is not a
 * persistence or interchange format and may change between releases.</p>
 */
package com.questrail.measure.codec;
