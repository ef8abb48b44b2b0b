/**
 * Default implementations of the codec seams.
 *
 * <p>Header fields are resolved through {@link com.questrail.replay.codec.impl.LayeredResolver}:
 * fixed offsets first, a scored scan second, a documented default last. Every
 * tier below the primary one is reported back to the caller.</p>
 */
package com.questrail.replay.codec.impl;
