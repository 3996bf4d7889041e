/* (C)2026 Macstab GmbH */

/** Composite structures spreading items over several child structures. */
package com.macstab.oss.redis.structures.multi;
