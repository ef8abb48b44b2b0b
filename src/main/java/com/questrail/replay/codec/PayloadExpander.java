package com.questrail.replay.codec;

/**
 * PayloadExpander
 * -----------------------------------------------------------------------------
 * Locates and inflates the compressed body that follows the signature of a
 * modern replay.
 *
 * <p>The expander is responsible only for:</p>
 * <ul>
 *   <li>Detecting a compression stream header in the prolog</li>
 *   <li>Inflating it with a short ordered list of parameterisations</li>
 *   <li>Rejecting output that does not resemble replay data</li>
 * </ul>
 *
 * <p>It never fails: when no attempt produces plausible output the prolog is
 * returned unchanged with {@link ExpandedPayload.Status#FALLBACK_RAW}.</p>
 */
public interface PayloadExpander
{
    /**
     * Expand the bytes that follow the file signature.
     *
     * @param prolog bytes after the signature; not modified
     * @return the body the header should be read from
     */
    ExpandedPayload expand(byte[] prolog);
}
