// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import de.mossgrabers.rackanalyzer.config.AnalyzerConfig;


/**
 * Base interface for source and destination formats.
 *
 * @author Jürgen Moßgraber
 */
public interface ICoreTask
{
    /**
     * Get the name of the object.
     *
     * @return The name
     */
    String getName ();


    /**
     * Load the settings from the configuration.
     *
     * @param config Where to load from
     */
    void loadSettings (AnalyzerConfig config);
}
