// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;


/**
 * The interface to a textual output format of a decoded rack.
 *
 * @author Jürgen Moßgraber
 */
public interface IDestinationFormat extends ICoreTask
{
    /**
     * Write the rack.
     *
     * @param rackAnalysis The rack to write
     * @param writer Where to write to
     * @throws IOException Could not write
     */
    void write (RackAnalysis rackAnalysis, Writer writer) throws IOException;


    /**
     * Format the rack as a text.
     *
     * @param rackAnalysis The rack to format
     * @return The text
     */
    default String format (final RackAnalysis rackAnalysis)
    {
        final StringWriter writer = new StringWriter ();
        try
        {
            this.write (rackAnalysis, writer);
        }
        catch (final IOException ex)
        {
            // A string writer does not throw
            throw new IllegalStateException (ex);
        }
        return writer.toString ();
    }
}
