// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import de.mossgrabers.rackanalyzer.INotifier;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.Optional;
import java.util.concurrent.Callable;


/**
 * The task to analyze one rack file. Problems are reported to the notifier and do not affect tasks
 * for other files.
 *
 * @author Jürgen Moßgraber
 */
public class AnalysisTask implements Callable<Optional<RackAnalysis>>
{
    private final File          sourceFile;
    private final ISourceFormat sourceFormat;
    private final INotifier     notifier;


    /**
     * Constructor.
     *
     * @param sourceFile The rack file to analyze
     * @param sourceFormat The format of the source file
     * @param notifier Where to log to
     */
    public AnalysisTask (final File sourceFile, final ISourceFormat sourceFormat, final INotifier notifier)
    {
        this.sourceFile = sourceFile;
        this.sourceFormat = sourceFormat;
        this.notifier = notifier;
    }


    /** {@inheritDoc} */
    @Override
    public Optional<RackAnalysis> call ()
    {
        if (this.notifier.isCancelled ())
        {
            this.notifier.log ("IDS_NOTIFY_CANCELED");
            return Optional.empty ();
        }

        final String path = this.sourceFile.getAbsolutePath ();
        this.notifier.log ("IDS_NOTIFY_PARSING_FILE", path);

        final RackAnalysis rackAnalysis;
        try
        {
            rackAnalysis = this.sourceFormat.read (this.sourceFile);
        }
        catch (final IOException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_READ", ex);
            return Optional.empty ();
        }
        catch (final ParseException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_PARSE", ex);
            return Optional.empty ();
        }
        catch (final RuntimeException ex)
        {
            this.notifier.logError (ex);
            return Optional.empty ();
        }

        for (final String warning: rackAnalysis.getWarnings ())
            this.notifier.logWarning ("IDS_NOTIFY_DECODE_WARNING", this.sourceFile.getName (), warning);

        this.notifier.log ("IDS_NOTIFY_ANALYSIS_FINISHED", rackAnalysis.getUseCase (), Integer.toString (rackAnalysis.getChains ().size ()), Integer.toString (rackAnalysis.countDevices ()), Integer.toString (rackAnalysis.getMacroControls ().size ()));
        return Optional.of (rackAnalysis);
    }
}
