package com.questrail.replay.catalog;

import com.questrail.replay.model.BuildAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OpcodeCatalogTest
{
    @Test
    void frameMarkersAreNotOpcodes()
    {
        for (int marker = 0x00; marker <= 0x03; marker++) {
            assertFalse(OpcodeCatalog.isKnown(marker), "marker " + marker);
        }
    }

    @Test
    void trainIsAnEffectiveTwoByteBuildStep()
    {
        OpcodeDescriptor train = OpcodeCatalog.lookup(0x1D).orElseThrow();

        assertEquals("Train", train.name());
        assertEquals(2, train.parameterLength());
        assertTrue(train.effective());
        assertEquals(CommandCategory.TRAIN, train.category());
        assertEquals(ParameterShape.ENTITY, train.shape());
        assertEquals(BuildAction.TRAIN, train.category().buildAction().orElseThrow());
    }

    @Test
    void selectionIsNotEffective()
    {
        OpcodeDescriptor select = OpcodeCatalog.lookup(0x09).orElseThrow();
        assertFalse(select.effective());
        assertTrue(select.category().buildAction().isEmpty());
    }

    @Test
    void chatIsTheOnlyVariableLengthOpcode()
    {
        assertTrue(OpcodeCatalog.lookup(OpcodeCatalog.CHAT).orElseThrow().isVariableLength());

        long variable = OpcodeCatalog.all().values().stream()
                .filter(OpcodeDescriptor::isVariableLength)
                .count();
        assertEquals(1, variable);
    }

    @Test
    void buildOrderOpcodesCarryDecodableParameters()
    {
        for (OpcodeDescriptor d : OpcodeCatalog.all().values()) {
            if (d.category().buildAction().isPresent()) {
                assertNotEquals(ParameterShape.RAW, d.shape(), d.name());
                assertTrue(d.effective(), d.name());
            }
        }
    }

    @Test
    void unknownOpcodes()
    {
        assertTrue(OpcodeCatalog.lookup(0x04).isEmpty());
        assertTrue(OpcodeCatalog.lookup(0xFF).isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> OpcodeCatalog.all().remove(0x1D));
    }
}
