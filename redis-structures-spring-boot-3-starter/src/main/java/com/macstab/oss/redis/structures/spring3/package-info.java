/* (C)2026 Macstab GmbH */

/**
 * Spring Boot 3.x auto-configuration for Redis-backed structures.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Add dependency (Maven):</strong>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss.redis</groupId>
 *   <artifactId>redis-structures-spring-boot-3-starter</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p><strong>2. Configure (application.yml):</strong>
 *
 * <pre>{@code
 * spring:
 *   data:
 *     redis:
 *       host: redis.example.com
 *       port: 6379
 *       structures:
 *         blocking-slice: 5s
 * }</pre>
 *
 * <p><strong>3. Inject {@link com.macstab.oss.redis.structures.StructureFactory}.</strong>
 *
 * <p>Add {@code redis-structures-metrics} and Spring Boot Actuator to publish {@code
 * redis.structures.*} counters.
 *
 * @since 1.0.0
 */
package com.macstab.oss.redis.structures.spring3;
