/**
 * Weighted modulo-11 check digit calculation (eCH-0097, section 2.4.2).
 *
 * @since 1.0.0
 * @author SwissUid Team
 */
package com.ryuqq.swissuid.core.checksum;
