/**
 * Text codec for Swiss UIDs.
 *
 * <p>This package turns text into validated {@link com.ryuqq.swissuid.core.model.SwissUid}
 * instances and back.</p>
 *
 * <h2>Entry Points</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swissuid.core.codec.UidCodec#parse(String)} - Throws {@link com.ryuqq.swissuid.core.model.UidParseException} on failure</li>
 *   <li>{@link com.ryuqq.swissuid.core.codec.UidCodec#tryParse(String)} - Returns a {@link com.ryuqq.swissuid.core.codec.ParseResult}</li>
 *   <li>{@link com.ryuqq.swissuid.core.codec.UidCodec#format(com.ryuqq.swissuid.core.model.SwissUid, com.ryuqq.swissuid.core.model.UidFormat)} - Renders PLAIN, HR or MWST</li>
 * </ul>
 *
 * <h2>Parse Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.swissuid.core.codec.ParseResult} - Sealed interface (permits Parsed, Rejected)</li>
 *   <li>{@link com.ryuqq.swissuid.core.codec.Parsed} - Validated UID</li>
 *   <li>{@link com.ryuqq.swissuid.core.codec.Rejected} - Failure kind and message</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SwissUid Team
 */
package com.ryuqq.swissuid.core.codec;
