// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPOutputStream;


class StreamHelperTest
{
    @Test
    void peekDoesNotConsume () throws IOException
    {
        final InputStream in = new BufferedInputStream (new ByteArrayInputStream (new byte [] { 0x34, 0x12, 0x56 }));

        assertEquals (0x1234, StreamHelper.peekShortLittleEndian (in));
        assertEquals (0x34, in.read ());
    }


    @Test
    void peekOnShortStream () throws IOException
    {
        assertEquals (-1, StreamHelper.peekShortLittleEndian (new BufferedInputStream (new ByteArrayInputStream (new byte [] { 1 }))));
    }


    @Test
    void peekNeedsMarkSupport ()
    {
        final InputStream in = new InputStream ()
        {
            @Override
            public int read ()
            {
                return -1;
            }
        };
        assertThrows (IOException.class, () -> StreamHelper.peekShortLittleEndian (in));
    }


    @Test
    void compressedAndPlainContent () throws IOException
    {
        final byte [] content = "<Ableton />".getBytes ();
        final ByteArrayOutputStream out = new ByteArrayOutputStream ();
        try (final GZIPOutputStream gzip = new GZIPOutputStream (out))
        {
            gzip.write (content);
        }

        try (final InputStream in = StreamHelper.uncompressIfNecessary (new ByteArrayInputStream (out.toByteArray ())))
        {
            assertArrayEquals (content, in.readAllBytes ());
        }
        try (final InputStream in = StreamHelper.uncompressIfNecessary (new ByteArrayInputStream (content)))
        {
            assertArrayEquals (content, in.readAllBytes ());
        }
    }
}
