// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rackanalyzer.format.ableton;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.rackanalyzer.core.DeviceCategory;
import de.mossgrabers.rackanalyzer.core.DeviceType;

import org.junit.jupiter.api.Test;

import java.util.Map;


class DeviceRegistryTest
{
    @Test
    void knownTagsAreClassified ()
    {
        assertEquals (DeviceType.EQ_EIGHT, DeviceRegistry.classify ("Eq8").orElseThrow ());
        assertEquals (DeviceType.COMPRESSOR, DeviceRegistry.classify ("Compressor2").orElseThrow ());
        assertEquals (DeviceType.AUDIO_EFFECT_RACK, DeviceRegistry.classify ("AudioEffectGroupDevice").orElseThrow ());
        assertEquals (DeviceCategory.INSTRUMENT, DeviceRegistry.classify ("Operator").orElseThrow ().getCategory ());
    }


    @Test
    void unknownTagsAreNotClassified ()
    {
        assertTrue (DeviceRegistry.classify ("Devices").isEmpty ());
        assertTrue (DeviceRegistry.classify ("eq8").isEmpty ());
        assertTrue (DeviceRegistry.classify ("").isEmpty ());
    }


    @Test
    void onlyGroupDevicesAreRacks ()
    {
        for (final Map.Entry<String, DeviceType> entry: DeviceRegistry.getAll ().entrySet ())
        {
            assertEquals (entry.getKey (), entry.getValue ().getTag ());
            final boolean isGroup = entry.getKey ().endsWith ("GroupDevice");
            assertEquals (isGroup, entry.getValue ().isRack (), entry.getKey ());
            assertFalse (entry.getValue ().getLabel ().isBlank ());
        }
        assertEquals (DeviceType.values ().length, DeviceRegistry.getAll ().size ());
    }
}
