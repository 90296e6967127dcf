// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.core;

import java.util.List;


/**
 * The decoded structure of one rack preset: its' named macro controls and its' chains with all
 * devices.
 *
 * @author Jürgen Moßgraber
 */
public class RackAnalysis
{
    private final String             rackName;
    private final String             useCase;
    private final List<MacroControl> macroControls;
    private final List<Chain>        chains;
    private final List<String>       warnings;


    /**
     * Constructor.
     *
     * @param rackName The name of the rack
     * @param useCase The use case, derived from the file name
     * @param macroControls The named macro controls ordered by their slot index
     * @param chains The top level chains of the rack
     * @param warnings Data problems which did not stop the decoding
     */
    public RackAnalysis (final String rackName, final String useCase, final List<MacroControl> macroControls, final List<Chain> chains, final List<String> warnings)
    {
        this.rackName = rackName;
        this.useCase = useCase;
        this.macroControls = List.copyOf (macroControls);
        this.chains = List.copyOf (chains);
        this.warnings = List.copyOf (warnings);
    }


    /**
     * Get the name of the rack.
     *
     * @return The name
     */
    public String getRackName ()
    {
        return this.rackName;
    }


    /**
     * Get the use case.
     *
     * @return The use case
     */
    public String getUseCase ()
    {
        return this.useCase;
    }


    /**
     * Get the macro controls which were named by the user.
     *
     * @return The controls ordered by their slot index
     */
    public List<MacroControl> getMacroControls ()
    {
        return this.macroControls;
    }


    /**
     * Get the top level chains.
     *
     * @return The chains in document order
     */
    public List<Chain> getChains ()
    {
        return this.chains;
    }


    /**
     * Get the warnings which were reported while decoding, e.g. a macro value which is not a
     * number.
     *
     * @return The warnings, empty if there were no problems
     */
    public List<String> getWarnings ()
    {
        return this.warnings;
    }


    /**
     * Count all devices of all chains including the devices in nested racks.
     *
     * @return The number of devices
     */
    public int countDevices ()
    {
        int count = 0;
        for (final Chain chain: this.chains)
            count += chain.countDevices ();
        return count;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.rackName + " " + this.macroControls + " " + this.chains;
    }
}
