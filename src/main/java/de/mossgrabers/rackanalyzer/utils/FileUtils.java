// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.utils;

import java.io.File;
import java.util.Locale;


/**
 * Helper functions for file names.
 *
 * @author Jürgen Moßgraber
 */
public class FileUtils
{
    /**
     * Private due to helper class.
     */
    private FileUtils ()
    {
        // Intentionally empty
    }


    /**
     * Get the name of a file without the directory and without the extension. Both '/' and '\'
     * are treated as directory separators.
     *
     * @param filename The file name, may contain a path
     * @return The name
     */
    public static String getNameWithoutType (final String filename)
    {
        final int separator = Math.max (filename.lastIndexOf ('/'), filename.lastIndexOf ('\\'));
        final String name = separator >= 0 ? filename.substring (separator + 1) : filename;
        final int pos = name.lastIndexOf ('.');
        return pos > 0 ? name.substring (0, pos) : name;
    }


    /**
     * Get the extension of a file in lower case.
     *
     * @param file The file
     * @return The extension without the dot, empty if there is none
     */
    public static String getType (final File file)
    {
        final String name = file.getName ();
        final int pos = name.lastIndexOf ('.');
        return pos > 0 ? name.substring (pos + 1).toLowerCase (Locale.ROOT) : "";
    }
}
