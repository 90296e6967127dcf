// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.utils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;


/**
 * Helper functions for input streams.
 *
 * @author Jürgen Moßgraber
 */
public class StreamHelper
{
    private static final int GZIP_MAGIC = 0x8B1F;


    /**
     * Private due to helper class.
     */
    private StreamHelper ()
    {
        // Intentionally empty
    }


    /**
     * Peeks a 2-byte unsigned integer in little endian format (LSB first) without consuming it.
     *
     * @param input The input stream, must support mark and reset
     * @return The integer value or -1 if the stream has less than 2 bytes
     * @throws IOException Stream error
     */
    public static int peekShortLittleEndian (final InputStream input) throws IOException
    {
        if (!input.markSupported ())
            throw new IOException ("Stream does not support mark/reset.");

        input.mark (2);
        final byte [] word = input.readNBytes (2);
        input.reset ();
        if (word.length < 2)
            return -1;
        return (word[1] & 0xFF) << 8 | word[0] & 0xFF;
    }


    /**
     * Wraps the stream into a GZIP decompressing stream if it starts with the GZIP magic number.
     * Otherwise the content is passed through unchanged.
     *
     * @param input The input stream
     * @return The stream to read the uncompressed content from
     * @throws IOException Stream error or broken GZIP header
     */
    public static InputStream uncompressIfNecessary (final InputStream input) throws IOException
    {
        final BufferedInputStream buffered = input instanceof final BufferedInputStream bis ? bis : new BufferedInputStream (input);
        if (peekShortLittleEndian (buffered) == GZIP_MAGIC)
            return new GZIPInputStream (buffered);
        return buffered;
    }
}
