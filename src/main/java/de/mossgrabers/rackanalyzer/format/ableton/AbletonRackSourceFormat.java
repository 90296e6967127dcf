// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import de.mossgrabers.rackanalyzer.INotifier;
import de.mossgrabers.rackanalyzer.config.AnalyzerConfig;
import de.mossgrabers.rackanalyzer.core.AbstractCoreTask;
import de.mossgrabers.rackanalyzer.core.ISourceFormat;
import de.mossgrabers.rackanalyzer.core.RackAnalysis;
import de.mossgrabers.rackanalyzer.model.AbletonXml;
import de.mossgrabers.rackanalyzer.model.XmlNode;
import de.mossgrabers.rackanalyzer.utils.FileUtils;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;


/**
 * Loads an Ableton rack preset (adg, adv) as the source.
 *
 * @author Jürgen Moßgraber
 */
public class AbletonRackSourceFormat extends AbstractCoreTask implements ISourceFormat
{
    private static final List<String> DEFAULT_EXTENSIONS = List.of ("adg", "adv");

    private final List<String>        extensions         = new ArrayList<> (DEFAULT_EXTENSIONS);


    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public AbletonRackSourceFormat (final INotifier notifier)
    {
        super ("Ableton Rack", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public void loadSettings (final AnalyzerConfig config)
    {
        final List<String> configured = config.getList (AnalyzerConfig.RACK_EXTENSIONS);
        if (configured.isEmpty ())
            return;

        this.extensions.clear ();
        for (final String extension: configured)
            this.extensions.add (extension.toLowerCase (Locale.ROOT));
    }


    /** {@inheritDoc} */
    @Override
    public List<String> getExtensions ()
    {
        return List.copyOf (this.extensions);
    }


    /** {@inheritDoc} */
    @Override
    public RackAnalysis read (final File sourceFile) throws IOException, ParseException
    {
        if (!this.extensions.contains (FileUtils.getType (sourceFile)))
            throw new IOException ("Not a rack file (supported are " + String.join (", ", this.extensions) + "): " + sourceFile.getName ());

        final XmlNode root;
        try (final InputStream in = new FileInputStream (sourceFile))
        {
            root = AbletonXml.parse (in);
        }
        return RackStructureDecoder.decode (root, sourceFile.getName (), this.notifier);
    }
}
