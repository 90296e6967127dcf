// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.text;

import de.mossgrabers.rackanalyzer.INotifier;
import de.mossgrabers.rackanalyzer.config.AnalyzerConfig;
import de.mossgrabers.rackanalyzer.core.AbstractCoreTask;
import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.Device;
import de.mossgrabers.rackanalyzer.core.IDestinationFormat;
import de.mossgrabers.rackanalyzer.core.MacroControl;
import de.mossgrabers.rackanalyzer.core.RackAnalysis;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;


/**
 * Writes a readable summary of a decoded rack: the named macros, the chains with their device
 * counts and the device tree.
 *
 * @author Jürgen Moßgraber
 */
public class RackSummaryFormat extends AbstractCoreTask implements IDestinationFormat
{
    private static final String INDENT         = "   ";
    private static final String NESTED_INDENT  = "    ";
    private static final String UNNAMED_CHAIN  = "[Unnamed Chain]";
    private static final String LINE_SEPARATOR = "\n";

    private boolean             quiet          = false;


    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public RackSummaryFormat (final INotifier notifier)
    {
        super ("Summary", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public void loadSettings (final AnalyzerConfig config)
    {
        this.quiet = config.getBoolean (AnalyzerConfig.SUMMARY_QUIET);
    }


    /**
     * If quiet, the devices are not listed.
     *
     * @param quiet True to only write the counts
     */
    public void setQuiet (final boolean quiet)
    {
        this.quiet = quiet;
    }


    /** {@inheritDoc} */
    @Override
    public void write (final RackAnalysis rackAnalysis, final Writer writer) throws IOException
    {
        this.notifier.log ("IDS_NOTIFY_WRITING_OUTPUT", this.name, rackAnalysis.getRackName ());

        final StringBuilder sb = new StringBuilder ();
        sb.append ("Rack: ").append (rackAnalysis.getRackName ()).append (LINE_SEPARATOR);
        sb.append ("Use Case: ").append (rackAnalysis.getUseCase ()).append (LINE_SEPARATOR);

        final List<MacroControl> macroControls = rackAnalysis.getMacroControls ();
        sb.append (LINE_SEPARATOR).append ("Named Macro Controls: ").append (macroControls.size ()).append (LINE_SEPARATOR);
        for (final MacroControl macroControl: macroControls)
            sb.append (INDENT).append ("- ").append (macroControl.getName ()).append (": ").append (macroControl.getValue ()).append (LINE_SEPARATOR);

        final List<Chain> chains = rackAnalysis.getChains ();
        sb.append (LINE_SEPARATOR).append ("Chains: ").append (chains.size ()).append (LINE_SEPARATOR);
        for (final Chain chain: chains)
        {
            sb.append (LINE_SEPARATOR).append (formatChainName (chain)).append (LINE_SEPARATOR);
            sb.append (INDENT).append ("Devices: ").append (chain.countDevices ()).append (LINE_SEPARATOR);
            if (!this.quiet)
                formatDevices (sb, chain.getDevices (), INDENT);
        }

        sb.append (LINE_SEPARATOR).append ("Total Devices Across All Chains: ").append (rackAnalysis.countDevices ()).append (LINE_SEPARATOR);
        writer.write (sb.toString ());
        writer.flush ();
    }


    /**
     * Format the devices and recursively the chains of nested racks.
     *
     * @param sb Where to append the text
     * @param devices The devices to format
     * @param indent The indentation of the current nesting level
     */
    private static void formatDevices (final StringBuilder sb, final List<Device> devices, final String indent)
    {
        for (final Device device: devices)
        {
            sb.append (indent).append (device.isOn () ? "[on]  " : "[off] ").append (device.getName ()).append (" (").append (device.getType ().getTag ()).append (')').append (LINE_SEPARATOR);

            final Optional<List<Chain>> nestedChains = device.getChains ();
            if (nestedChains.isEmpty ())
                continue;
            for (final Chain nestedChain: nestedChains.get ())
            {
                sb.append (indent).append ("  ").append (formatChainName (nestedChain)).append (LINE_SEPARATOR);
                formatDevices (sb, nestedChain.getDevices (), indent + NESTED_INDENT);
            }
        }
    }


    private static String formatChainName (final Chain chain)
    {
        final String name = chain.getName ();
        final StringBuilder sb = new StringBuilder ("Chain: ").append (name == null || name.isEmpty () ? UNNAMED_CHAIN : name);
        if (chain.isSoloed ())
            sb.append (" (SOLOED)");
        return sb.toString ();
    }
}
