/* (C)2026 Macstab GmbH */

/**
 * Queues and stacks persisted in Redis lists (no Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Every {@link com.macstab.oss.redis.structures.Structure} is one Redis list under the key
 * {@code namespace:name}. Producers and consumers in different processes share a structure by
 * using the same key against the same Redis database.
 *
 * <h2>Command Mapping</h2>
 *
 * <table>
 *   <caption>Structure operations and Redis commands</caption>
 *   <thead>
 *     <tr>
 *       <th>Operation</th>
 *       <th>Queue</th>
 *       <th>Stack</th>
 *     </tr>
 *   </thead>
 *   <tbody>
 *     <tr>
 *       <td>put</td>
 *       <td>RPUSH</td>
 *       <td>RPUSH</td>
 *     </tr>
 *     <tr>
 *       <td>get (non-blocking)</td>
 *       <td>LPOP</td>
 *       <td>RPOP</td>
 *     </tr>
 *     <tr>
 *       <td>get (blocking)</td>
 *       <td>BLPOP</td>
 *       <td>BRPOP</td>
 *     </tr>
 *     <tr>
 *       <td>size</td>
 *       <td>LLEN</td>
 *       <td>LLEN</td>
 *     </tr>
 *   </tbody>
 * </table>
 *
 * <h2>Key Components</h2>
 *
 * <dl>
 *   <dt>{@link com.macstab.oss.redis.structures.StructureFactory}
 *   <dd>Creates queues and stacks on one store. Assigns default names {@code 0, 1, 2...} per kind.
 *   <dt>{@link com.macstab.oss.redis.structures.store.LettuceListStore}
 *   <dd>The Redis connections. One store per process serves producers and blocking consumers alike.
 *       Blocking gets run on a bounded pool of their own connections.
 *   <dt>{@link com.macstab.oss.redis.structures.codec.EncodingDecorator}
 *   <dd>Stores arbitrary values as JSON (optionally deflate-compressed) text.
 *   <dt>{@link com.macstab.oss.redis.structures.multi.MultiStructure}
 *   <dd>Spreads one logical structure over several keys, optionally preserving global order.
 * </dl>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (LettuceListStore store = LettuceListStore.connect(RedisConnectionSettings.defaults())) {
 *   StructureFactory factory = new StructureFactory(store);
 *
 *   RedisQueue jobs = factory.queue("jobs");
 *   jobs.put("job-1");
 *   Optional<String> next = jobs.get(true, Duration.ofSeconds(5));
 * }
 * }</pre>
 *
 * <h2>Delivery Semantics</h2>
 *
 * <p>Pops are destructive and unacknowledged: an item taken by a consumer that crashes before
 * processing it is lost. There is no visibility timeout and no dead-letter list.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Structures hold no mutable state besides the store, and Redis serializes commands per key, so
 * any number of threads and processes may put and get concurrently.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 * @see com.macstab.oss.redis.structures.Structure
 */
package com.macstab.oss.redis.structures;
