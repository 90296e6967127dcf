// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.json;

import de.mossgrabers.rackanalyzer.INotifier;
import de.mossgrabers.rackanalyzer.config.AnalyzerConfig;
import de.mossgrabers.rackanalyzer.core.AbstractCoreTask;
import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.Device;
import de.mossgrabers.rackanalyzer.core.IDestinationFormat;
import de.mossgrabers.rackanalyzer.core.MacroControl;
import de.mossgrabers.rackanalyzer.core.RackAnalysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;


/**
 * Writes a decoded rack as a JSON document. The structure is read by the reporting tools and
 * therefore must not be changed:
 *
 * <pre>
 * {rack_name, use_case, macro_controls:[{name,value,index}],
 *  chains:[{name,is_soloed,devices:[{type,name,is_on,chains?:[...]}]}]}
 * </pre>
 *
 * @author Jürgen Moßgraber
 */
public class RackJsonFormat extends AbstractCoreTask implements IDestinationFormat
{
    private static final String KEY_RACK_NAME      = "rack_name";
    private static final String KEY_USE_CASE       = "use_case";
    private static final String KEY_MACRO_CONTROLS = "macro_controls";
    private static final String KEY_CHAINS         = "chains";
    private static final String KEY_NAME           = "name";
    private static final String KEY_VALUE          = "value";
    private static final String KEY_INDEX          = "index";
    private static final String KEY_IS_SOLOED      = "is_soloed";
    private static final String KEY_DEVICES        = "devices";
    private static final String KEY_TYPE           = "type";
    private static final String KEY_IS_ON          = "is_on";

    private boolean             prettyPrinting     = true;


    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public RackJsonFormat (final INotifier notifier)
    {
        super ("JSON", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public void loadSettings (final AnalyzerConfig config)
    {
        this.prettyPrinting = config.getBoolean (AnalyzerConfig.JSON_PRETTY);
    }


    /**
     * Enable or disable the indentation of the output.
     *
     * @param prettyPrinting True to indent
     */
    public void setPrettyPrinting (final boolean prettyPrinting)
    {
        this.prettyPrinting = prettyPrinting;
    }


    /** {@inheritDoc} */
    @Override
    public void write (final RackAnalysis rackAnalysis, final Writer writer) throws IOException
    {
        this.notifier.log ("IDS_NOTIFY_WRITING_OUTPUT", this.name, rackAnalysis.getRackName ());

        final GsonBuilder builder = new GsonBuilder ().disableHtmlEscaping ().serializeSpecialFloatingPointValues ();
        if (this.prettyPrinting)
            builder.setPrettyPrinting ();
        final Gson gson = builder.create ();

        try
        {
            gson.toJson (toJson (rackAnalysis), writer);
            writer.flush ();
        }
        catch (final JsonIOException ex)
        {
            throw new IOException (ex);
        }
    }


    /**
     * Create the JSON document of a rack.
     *
     * @param rackAnalysis The rack
     * @return The JSON root object
     */
    public static JsonObject toJson (final RackAnalysis rackAnalysis)
    {
        final JsonObject root = new JsonObject ();
        root.addProperty (KEY_RACK_NAME, rackAnalysis.getRackName ());
        root.addProperty (KEY_USE_CASE, rackAnalysis.getUseCase ());

        final JsonArray macros = new JsonArray ();
        for (final MacroControl macroControl: rackAnalysis.getMacroControls ())
        {
            final JsonObject macro = new JsonObject ();
            macro.addProperty (KEY_NAME, macroControl.getName ());
            macro.addProperty (KEY_VALUE, Double.valueOf (macroControl.getValue ()));
            macro.addProperty (KEY_INDEX, Integer.valueOf (macroControl.getIndex ()));
            macros.add (macro);
        }
        root.add (KEY_MACRO_CONTROLS, macros);

        root.add (KEY_CHAINS, convertChains (rackAnalysis.getChains ()));
        return root;
    }


    private static JsonArray convertChains (final List<Chain> chains)
    {
        final JsonArray result = new JsonArray ();
        for (final Chain chain: chains)
        {
            final JsonObject chainObject = new JsonObject ();
            chainObject.addProperty (KEY_NAME, chain.getName ());
            chainObject.addProperty (KEY_IS_SOLOED, Boolean.valueOf (chain.isSoloed ()));

            final JsonArray devices = new JsonArray ();
            for (final Device device: chain.getDevices ())
                devices.add (convertDevice (device));
            chainObject.add (KEY_DEVICES, devices);

            result.add (chainObject);
        }
        return result;
    }


    private static JsonObject convertDevice (final Device device)
    {
        final JsonObject deviceObject = new JsonObject ();
        deviceObject.addProperty (KEY_TYPE, device.getType ().getTag ());
        deviceObject.addProperty (KEY_NAME, device.getName ());
        deviceObject.addProperty (KEY_IS_ON, Boolean.valueOf (device.isOn ()));

        final Optional<List<Chain>> chains = device.getChains ();
        if (chains.isPresent ())
            deviceObject.add (KEY_CHAINS, convertChains (chains.get ()));
        return deviceObject;
    }
}
