// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import de.mossgrabers.rackanalyzer.INotifier;
import de.mossgrabers.rackanalyzer.config.AnalyzerConfig;


/**
 * Base class for source and destination formats.
 *
 * @author Jürgen Moßgraber
 */
public abstract class AbstractCoreTask implements ICoreTask
{
    protected final String    name;
    protected final INotifier notifier;


    /**
     * Constructor.
     *
     * @param name The name of the object
     * @param notifier The notifier
     */
    protected AbstractCoreTask (final String name, final INotifier notifier)
    {
        this.name = name;
        this.notifier = notifier;
    }


    /** {@inheritDoc} */
    @Override
    public String getName ()
    {
        return this.name;
    }


    /** {@inheritDoc} */
    @Override
    public void loadSettings (final AnalyzerConfig config)
    {
        // Intentionally empty
    }
}
