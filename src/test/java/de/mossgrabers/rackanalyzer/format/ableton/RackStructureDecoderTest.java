// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.audioBranch;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.branches;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.device;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.deviceChain;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.document;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.element;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.instrumentBranch;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.macro;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.on;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.parse;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.userName;
import static de.mossgrabers.rackanalyzer.format.ableton.RackDocuments.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.rackanalyzer.RecordingNotifier;
import de.mossgrabers.rackanalyzer.core.Chain;
import de.mossgrabers.rackanalyzer.core.Device;
import de.mossgrabers.rackanalyzer.core.DeviceType;
import de.mossgrabers.rackanalyzer.core.RackAnalysis;
import de.mossgrabers.rackanalyzer.model.XmlNode;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.List;


class RackStructureDecoderTest
{
    private static final String NESTED_RACK = device ("AudioEffectGroupDevice", userName ("Inner Rack"), on (true), branches (audioBranch ("Low", false, device ("Eq8", userName ("Low EQ"))), audioBranch ("High", true, device ("Eq8"))));


    @Test
    void nestedRackDevicesAreOnlyListedInTheNestedChains () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", branches (audioBranch ("Outer", false, NESTED_RACK))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Deep.adg");

        assertEquals (1, analysis.getChains ().size ());
        final List<Device> outerDevices = analysis.getChains ().get (0).getDevices ();
        assertEquals (1, outerDevices.size ());

        final Device nestedRack = outerDevices.get (0);
        assertEquals (DeviceType.AUDIO_EFFECT_RACK, nestedRack.getType ());
        assertEquals ("Inner Rack", nestedRack.getName ());

        final List<Chain> nestedChains = nestedRack.getChains ().orElseThrow ();
        assertEquals (2, nestedChains.size ());
        for (final Chain nestedChain: nestedChains)
        {
            assertEquals (1, nestedChain.getDevices ().size ());
            assertEquals (DeviceType.EQ_EIGHT, nestedChain.getDevices ().get (0).getType ());
        }
        assertEquals ("Low EQ", nestedChains.get (0).getDevices ().get (0).getName ());
        assertEquals ("EQ Eight", nestedChains.get (1).getDevices ().get (0).getName ());
        assertTrue (nestedChains.get (1).isSoloed ());

        for (final Device device: outerDevices)
            assertNotEquals (DeviceType.EQ_EIGHT, device.getType ());
        assertEquals (3, analysis.countDevices ());
    }


    @Test
    void nestedRackInFlatRackIsNotFlattened () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", userName ("Flat Outer"), element ("Branches"), deviceChain (device ("Reverb"), NESTED_RACK, device ("Delay"))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Flat.adg");

        assertEquals (1, analysis.getChains ().size ());
        final Chain chain = analysis.getChains ().get (0);
        assertEquals ("Flat Outer", chain.getName ());
        assertEquals (3, chain.getDevices ().size ());
        assertEquals (DeviceType.REVERB, chain.getDevices ().get (0).getType ());
        assertEquals (DeviceType.AUDIO_EFFECT_RACK, chain.getDevices ().get (1).getType ());
        assertEquals (DeviceType.DELAY, chain.getDevices ().get (2).getType ());
        assertEquals (5, analysis.countDevices ());
    }


    @Test
    void everyDeviceElementIsCountedExactlyOnce () throws ParseException
    {
        final String deepest = device ("AudioEffectGroupDevice", branches (audioBranch ("A", false, device ("Compressor2"), device ("Limiter")), audioBranch ("B", false, NESTED_RACK)));
        final String middle = device ("AudioEffectGroupDevice", deviceChain (device ("Saturator"), deepest, device ("Gate")));
        final String xml = document (device ("AudioEffectGroupDevice", branches (audioBranch ("One", false, device ("Eq3"), middle), audioBranch ("Two", false, device ("AutoFilter"), NESTED_RACK))));
        final XmlNode root = parse (xml);

        final RackAnalysis analysis = RackStructureDecoder.decode (root, "Many.adg");

        int deviceElements = 0;
        for (final String tag: DeviceRegistry.getAll ().keySet ())
            deviceElements += root.findDescendants (tag).size ();
        // The top level rack itself is not part of a chain
        assertEquals (deviceElements - 1, analysis.countDevices ());

        int nestedSum = 0;
        for (final Chain chain: analysis.getChains ())
            nestedSum += countFlat (chain.getDevices ());
        assertEquals (analysis.countDevices (), nestedSum);
    }


    @Test
    void repeatedDeviceElementsAreOnlyAddedOnce () throws ParseException
    {
        final XmlNode root = new XmlNode ("Ableton");
        final XmlNode rack = new XmlNode ("AudioEffectGroupDevice");
        final XmlNode deviceChain = new XmlNode ("DeviceChain");
        final XmlNode devices = new XmlNode ("Devices");
        final XmlNode eq = new XmlNode ("Eq8");
        devices.addChildNode (eq);
        devices.addChildNode (eq);
        // The rack contains itself
        devices.addChildNode (rack);
        deviceChain.addChildNode (devices);
        rack.addChildNode (deviceChain);
        root.addChildNode (rack);

        final RackAnalysis analysis = RackStructureDecoder.decode (root, "Loop.adg");

        assertEquals (1, analysis.getChains ().size ());
        final List<Device> chainDevices = analysis.getChains ().get (0).getDevices ();
        assertEquals (1, chainDevices.size ());
        assertEquals (DeviceType.EQ_EIGHT, chainDevices.get (0).getType ());
        assertEquals (1, analysis.countDevices ());

        final List<String> warnings = analysis.getWarnings ();
        assertEquals (2, warnings.size ());
        assertTrue (warnings.get (0).contains ("Eq8"));
        assertTrue (warnings.get (1).contains ("AudioEffectGroupDevice"));
    }


    @Test
    void unknownDevicesAreReported () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", branches (audioBranch ("A", false, device ("FutureSpectralThing"), device ("Eq8")), audioBranch ("B", false, device ("FutureSpectralThing"), device ("OtherThing")))));
        final RecordingNotifier notifier = new RecordingNotifier ();

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Unknown.adg", notifier);

        assertEquals (1, analysis.countDevices ());
        assertEquals (List.of ("IDS_NOTIFY_UNKNOWN_DEVICE FutureSpectralThing", "IDS_NOTIFY_UNKNOWN_DEVICE OtherThing"), notifier.getInfos ());
        assertTrue (notifier.getWarnings ().isEmpty ());
    }


    @Test
    void flatRackWithoutBranchesUsesMainChain () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", deviceChain (device ("Chorus"), device ("Phaser"))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "NoBranches.adg");

        assertEquals (1, analysis.getChains ().size ());
        final Chain chain = analysis.getChains ().get (0);
        assertEquals (ChainEnumerator.MAIN_CHAIN_NAME, chain.getName ());
        assertFalse (chain.isSoloed ());
        assertEquals (2, chain.getDevices ().size ());
    }


    @Test
    void emptyRackHasNoChains () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", userName ("Empty"), element ("Branches"), deviceChain ()));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Empty.adg");

        assertTrue (analysis.getChains ().isEmpty ());
        assertEquals (0, analysis.countDevices ());
    }


    @Test
    void instrumentRackChainsAreNamedByName () throws ParseException
    {
        final String xml = document (device ("InstrumentGroupDevice", branches (instrumentBranch ("Keys", device ("Operator"), device ("Reverb")), instrumentBranch ("", device ("Simpler")))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Instrument.adg");

        assertEquals (2, analysis.getChains ().size ());
        assertEquals ("Keys", analysis.getChains ().get (0).getName ());
        assertEquals ("Chain 2", analysis.getChains ().get (1).getName ());
        assertEquals (DeviceType.OPERATOR, analysis.getChains ().get (0).getDevices ().get (0).getType ());
    }


    @Test
    void unknownDevicesAreSkipped () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", branches (audioBranch ("Chain", false, device ("Eq8"), device ("FutureSpectralThing"), device ("Reverb")))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Unknown.adg");

        final List<Device> devices = analysis.getChains ().get (0).getDevices ();
        assertEquals (2, devices.size ());
        assertEquals (DeviceType.EQ_EIGHT, devices.get (0).getType ());
        assertEquals (DeviceType.REVERB, devices.get (1).getType ());
    }


    @Test
    void branchWithoutDeviceChainHasNoDevices () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", branches (element ("AudioEffectBranchPreset", userName ("Dry")))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Dry.adg");

        assertEquals (1, analysis.getChains ().size ());
        assertEquals ("Dry", analysis.getChains ().get (0).getName ());
        assertTrue (analysis.getChains ().get (0).getDevices ().isEmpty ());
    }


    @Test
    void presetDocumentIsDecoded () throws ParseException
    {
        final String innerPreset = element ("AudioEffectGroupDevicePreset", element ("Device", device ("AudioEffectGroupDevice", userName ("Wrapped"), element ("Branches"))), element ("BranchPresets", element ("AudioEffectBranchPreset", userName ("Wet"), value ("IsSoloed", "false"), element ("DevicePresets", element ("AudioEffectPreset", element ("Device", device ("Delay", on (false))))))));
        final String xml = document (element ("GroupDevicePreset", element ("Device", device ("AudioEffectGroupDevice", macro (0, "Space", "12.5"), element ("Branches"))), element ("BranchPresets", element ("AudioEffectBranchPreset", userName ("Main"), value ("IsSoloed", "true"), element ("DevicePresets", element ("AudioEffectPreset", element ("Device", device ("Reverb"))), innerPreset)))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Preset.adg");

        assertEquals (1, analysis.getMacroControls ().size ());
        assertEquals ("Space", analysis.getMacroControls ().get (0).getName ());

        assertEquals (1, analysis.getChains ().size ());
        final Chain main = analysis.getChains ().get (0);
        assertEquals ("Main", main.getName ());
        assertTrue (main.isSoloed ());
        assertEquals (2, main.getDevices ().size ());

        final Device wrapped = main.getDevices ().get (1);
        assertEquals ("Wrapped", wrapped.getName ());
        final List<Chain> nestedChains = wrapped.getChains ().orElseThrow ();
        assertEquals (1, nestedChains.size ());
        assertEquals ("Wet", nestedChains.get (0).getName ());
        assertFalse (nestedChains.get (0).getDevices ().get (0).isOn ());
    }


    @Test
    void liveSetDeviceChainIsDecoded () throws ParseException
    {
        final String branch = element ("AudioEffectBranch", userName ("Set Chain"), element ("DeviceChain", element ("AudioToAudioDeviceChain", element ("Devices", device ("GlueCompressor")))));
        final String xml = document (device ("AudioEffectGroupDevice", branches (branch)));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Set.adg");

        assertEquals ("Set Chain", analysis.getChains ().get (0).getName ());
        assertEquals (DeviceType.GLUE_COMPRESSOR, analysis.getChains ().get (0).getDevices ().get (0).getType ());
    }


    @Test
    void rackIsFoundBelowTheRoot () throws ParseException
    {
        final String xml = document (element ("Wrapper", element ("Inner", device ("AudioEffectGroupDevice", deviceChain (device ("Redux"))))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), null);

        assertEquals (RackStructureDecoder.UNKNOWN_NAME, analysis.getRackName ());
        assertEquals (DeviceType.REDUX, analysis.getChains ().get (0).getDevices ().get (0).getType ());
    }


    @Test
    void namesAreTakenFromTheFileName () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice"));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "/racks/Bass - Growl Machine.adg");

        assertEquals ("Bass - Growl Machine", analysis.getRackName ());
        assertEquals ("Bass - Growl Machine", analysis.getUseCase ());
    }


    @Test
    void missingRootIsRejected ()
    {
        final XmlNode root = parse ("<Live><AudioEffectGroupDevice /></Live>");

        final ParseException ex = assertThrows (ParseException.class, () -> RackStructureDecoder.decode (root, "Wrong.adg"));
        assertTrue (ex.getMessage ().contains ("Ableton"));
    }


    @Test
    void documentWithoutRackIsRejected ()
    {
        final XmlNode root = parse (document (device ("Reverb")));

        assertThrows (ParseException.class, () -> RackStructureDecoder.decode (root, "NoRack.adv"));
    }


    @Test
    void invalidMacroValueIsReportedAsWarning () throws ParseException
    {
        final String xml = document (device ("AudioEffectGroupDevice", macro (2, "Drive", "loud"), deviceChain (device ("Saturator"))));

        final RackAnalysis analysis = RackStructureDecoder.decode (parse (xml), "Warn.adg");

        assertEquals (1, analysis.getMacroControls ().size ());
        assertEquals (0.0, analysis.getMacroControls ().get (0).getValue ());
        assertEquals (1, analysis.getWarnings ().size ());
        assertEquals (1, analysis.getChains ().size ());
    }


    private static int countFlat (final List<Device> devices)
    {
        int count = devices.size ();
        for (final Device device: devices)
        {
            if (device.getChains ().isPresent ())
            {
                for (final Chain chain: device.getChains ().get ())
                    count += countFlat (chain.getDevices ());
            }
        }
        return count;
    }
}
