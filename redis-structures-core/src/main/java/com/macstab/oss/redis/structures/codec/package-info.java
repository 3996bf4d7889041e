/* (C)2026 Macstab GmbH */

/**
 * Value encoding for structures that store text.
 *
 * <p>Encoders are chained by composition: {@code CompressionEncoder.of(JsonEncoder.of(Order.class))}
 * serializes to JSON, deflates, then Base64-encodes. Decoding never executes stored content.
 */
package com.macstab.oss.redis.structures.codec;
