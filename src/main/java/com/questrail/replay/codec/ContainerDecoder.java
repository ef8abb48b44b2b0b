package com.questrail.replay.codec;

/**
 * ContainerDecoder
 * -----------------------------------------------------------------------------
 * Decodes the replay container: signature, optional compressed body, header
 * fields and player table.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Rejecting input whose signature is not a replay signature</li>
 *   <li>Recovering header fields and the roster through fallback tiers</li>
 *   <li>Reporting where the command section starts</li>
 * </ul>
 *
 * <p>Past the signature check the decoder never throws; every fallback is
 * reported in {@link ContainerDecodeResult#issues()}.</p>
 */
public interface ContainerDecoder
{
    /**
     * Decode the container of a complete replay file.
     *
     * @param raw the whole file
     * @return header, roster and command section location
     * @throws InvalidFormatException if the input is shorter than the signature
     *                                or the signature is not recognised
     */
    ContainerDecodeResult decode(byte[] raw);
}
