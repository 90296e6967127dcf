// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.List;


/**
 * The interface to a rack source.
 *
 * @author Jürgen Moßgraber
 */
public interface ISourceFormat extends ICoreTask
{
    /**
     * Read and decode the rack file.
     *
     * @param sourceFile The rack file to load
     * @return The decoded rack
     * @throws IOException Could not read the file
     * @throws ParseException Could not parse the rack file
     */
    RackAnalysis read (File sourceFile) throws IOException, ParseException;


    /**
     * Get the file extensions which are supported by the format.
     *
     * @return The extensions without the dot in lower case
     */
    List<String> getExtensions ();
}
