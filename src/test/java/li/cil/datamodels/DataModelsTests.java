package li.cil.datamodels;

import li.cil.datamodels.api.CType;
import li.cil.datamodels.api.DataModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class DataModelsTests {
    @Test
    public void candidatesExposeSilp64Ambiguity() {
        assertEquals(List.of(DataModel.ILP64, DataModel.SILP64), DataModels.candidates(8, 8, 8));
        assertEquals(DataModel.ILP64, DataModel.of(8, 8, 8));
    }

    @Test
    public void candidatesAreUniqueForOtherModels() {
        assertEquals(List.of(DataModel.LP64), DataModels.candidates(4, 8, 8));
        assertEquals(List.of(DataModel.IP16), DataModels.candidates(2, 0, 2));
        assertEquals(List.of(DataModel.LLP64), DataModels.candidates(4, 4, 8));
    }

    @Test
    public void candidatesNeverIncludeUnknown() {
        assertTrue(DataModels.candidates(9, 9, 9).isEmpty());
        assertTrue(DataModels.candidates(0, 0, 0).isEmpty());
    }

    @Test
    public void everyModelIsPromotionOrdered() {
        for (final DataModel model : DataModel.values()) {
            assertTrue(DataModels.isPromotionOrdered(model), model.name());
        }
    }

    @Test
    public void fullyDefinedRowsAreNonDecreasing() {
        final CType[] order = {CType.CHAR, CType.SHORT, CType.INT, CType.LONG, CType.LONG_LONG};
        for (final DataModel model : DataModel.values()) {
            boolean allDefined = true;
            for (final CType type : order) {
                allDefined &= model.isDefined(type);
            }
            if (!allDefined) {
                continue;
            }
            for (int i = 1; i < order.length; i++) {
                assertTrue(model.sizeOf(order[i - 1]) <= model.sizeOf(order[i]), model + " " + order[i]);
            }
        }
    }

    @Test
    public void everyModelMeetsStandardMinimums() {
        for (final DataModel model : DataModel.values()) {
            assertTrue(DataModels.meetsStandardMinimums(model), model.name());
        }
    }

    @Test
    public void tableListsEveryModel() {
        final String[] lines = DataModels.formatTable().split("\n");
        assertEquals(1 + DataModel.values().length, lines.length);
        assertTrue(lines[0].contains("long long"));
        assertTrue(lines[0].contains("void *"));

        for (final DataModel model : DataModel.values()) {
            assertTrue(lines[1 + model.ordinal()].startsWith(model.name()));
        }

        assertArrayEquals(new String[]{"LP64", "1", "2", "4", "8", "8", "8"},
                lines[1 + DataModel.LP64.ordinal()].trim().split("\\s+"));
        assertArrayEquals(new String[]{"IP16", "1", "-", "2", "-", "-", "2"},
                lines[1 + DataModel.IP16.ordinal()].trim().split("\\s+"));
    }
}
