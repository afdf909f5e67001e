/**
 * Core domain model package for Swiss UIDs (eCH-0097).
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swissuid.core.model.SwissUid} - Validated UID (prefix, 8 payload digits, check digit)</li>
 *   <li>{@link com.ryuqq.swissuid.core.model.UidPrefix} - CHE or ADM</li>
 *   <li>{@link com.ryuqq.swissuid.core.model.UidFormat} - PLAIN, HR and MWST output forms</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swissuid.core.model.UidError} - Failure kinds</li>
 *   <li>{@link com.ryuqq.swissuid.core.model.UidParseException} - IllegalArgumentException carrying a UidError</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Factory validation ensures the check digit invariant</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 *   <li><strong>Compact:</strong> Payload digits are packed as nibbles into a single int</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SwissUid Team
 */
package com.ryuqq.swissuid.core.model;
