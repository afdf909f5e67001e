/**
 * Random generation of valid Swiss UIDs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swissuid.generator.SwissUidGenerator} - Generates UIDs with a valid check digit</li>
 *   <li>{@link com.ryuqq.swissuid.generator.GeneratorConfig} - Prefix and batch size limit</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SwissUid Team
 */
package com.ryuqq.swissuid.generator;
